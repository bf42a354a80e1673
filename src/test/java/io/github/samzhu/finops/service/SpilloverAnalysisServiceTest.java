package io.github.samzhu.finops.service;

import static io.github.samzhu.finops.service.AllocatedRecordFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.dto.AllocatedRecord;
import io.github.samzhu.finops.dto.StoreSpillover;
import io.github.samzhu.finops.dto.StoreSpillover.DevicePair;
import io.github.samzhu.finops.dto.StoreSpillover.Direction;

class SpilloverAnalysisServiceTest {

    private SpilloverAnalysisService service;

    @BeforeEach
    void setUp() {
        service = new SpilloverAnalysisService(FinopsProperties.defaults());
    }

    @Test
    void shouldReportStronglyCorrelatedDevicePairs() {
        // Given: POS-1 與 POS-2 同步增加，POS-3 反向
        List<AllocatedRecord> records = List.of(
            record(0, "POS-1", "1138", 1.0, 100, 1),
            record(1, "POS-1", "1138", 2.0, 100, 1),
            record(2, "POS-1", "1138", 3.0, 100, 1),
            record(0, "POS-2", "1138", 2.0, 100, 1),
            record(1, "POS-2", "1138", 4.0, 100, 1),
            record(2, "POS-2", "1138", 6.0, 100, 1),
            record(0, "POS-3", "1138", 3.0, 100, 1),
            record(1, "POS-3", "1138", 2.0, 100, 1),
            record(2, "POS-3", "1138", 1.0, 100, 1));

        // When
        List<StoreSpillover> results = service.analyze(records);

        // Then
        assertThat(results).hasSize(1);
        StoreSpillover store = results.get(0);
        assertThat(store.storeNumber()).isEqualTo("1138");
        assertThat(store.deviceCount()).isEqualTo(3);
        assertThat(store.totalStoreCost()).isCloseTo(24.0, within(1e-9));
        assertThat(store.avgDeviceCost()).isCloseTo(8.0, within(1e-9));
        assertThat(store.correlations()).hasSize(3);

        DevicePair first = store.correlations().get(0);
        assertThat(first.deviceA()).isEqualTo("POS-1");
        assertThat(first.deviceB()).isEqualTo("POS-2");
        assertThat(first.correlation()).isCloseTo(1.0, within(1e-9));
        assertThat(first.direction()).isEqualTo(Direction.POSITIVE);
        assertThat(store.correlations()).filteredOn(p -> p.direction() == Direction.NEGATIVE).hasSize(2);
    }

    @Test
    void shouldOmitStoresWithSingleDevice() {
        // Given
        List<AllocatedRecord> records = List.of(
            record(0, "POS-1", "2001", 1.0, 100, 1),
            record(1, "POS-1", "2001", 2.0, 100, 1));

        // When & Then
        assertThat(service.analyze(records)).isEmpty();
    }

    @Test
    void shouldOmitStoresWithoutCorrelatedPairs() {
        // Given: 相關係數約 0.45，未超過 0.7
        List<AllocatedRecord> records = List.of(
            record(0, "POS-1", "3001", 1.0, 100, 1),
            record(1, "POS-1", "3001", 2.0, 100, 1),
            record(2, "POS-1", "3001", 3.0, 100, 1),
            record(3, "POS-1", "3001", 4.0, 100, 1),
            record(0, "POS-2", "3001", 1.0, 100, 1),
            record(1, "POS-2", "3001", 3.0, 100, 1),
            record(2, "POS-2", "3001", 1.0, 100, 1),
            record(3, "POS-2", "3001", 3.0, 100, 1));

        // When & Then
        assertThat(service.analyze(records)).isEmpty();
    }

    @Test
    void shouldReturnEmptyForNoRecords() {
        assertThat(service.analyze(List.of())).isEmpty();
    }
}
