package io.github.samzhu.finops.service;

import static io.github.samzhu.finops.service.AllocatedRecordFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.dto.AllocatedRecord;
import io.github.samzhu.finops.dto.DevicePrediction;
import io.github.samzhu.finops.dto.DevicePrediction.Predictor;
import io.github.samzhu.finops.dto.TelemetryEvent;

class PredictiveAllocationServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-20T10:00:00Z");

    private PredictiveAllocationService service;

    @BeforeEach
    void setUp() {
        service = new PredictiveAllocationService(FinopsProperties.defaults());
    }

    @Test
    void shouldPredictFromTokensWhenCostTracksTokens() {
        // Given: 成本與 token 完全正相關，平均每 token 成本 15 / 1500 = 0.01
        List<AllocatedRecord> history = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            history.add(record(i, "POS-1", "1138", i, i * 100L, 3));
        }
        List<TelemetryEvent> current = List.of(event("POS-1", 100), event("POS-1", 200));

        // When
        List<DevicePrediction> predictions = service.predict(history, current);

        // Then
        assertThat(predictions).hasSize(1);
        DevicePrediction prediction = predictions.get(0);
        assertThat(prediction.predictor()).isEqualTo(Predictor.TOKENS);
        assertThat(prediction.tokenCorrelation()).isCloseTo(1.0, within(1e-9));
        assertThat(prediction.predictedCost()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void shouldPredictFromCallsWhenTokensAreFlat() {
        // Given: token 固定，成本與呼叫數相關，平均每次呼叫成本 15 / 15 = 1
        List<AllocatedRecord> history = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            history.add(record(i, "POS-2", "1138", i, 100, i));
        }
        List<TelemetryEvent> current = List.of(event("POS-2", 50), event("POS-2", 50));

        // When
        DevicePrediction prediction = service.predict(history, current).get(0);

        // Then
        assertThat(prediction.predictor()).isEqualTo(Predictor.API_CALLS);
        assertThat(prediction.tokenCorrelation()).isZero();
        assertThat(prediction.predictedCost()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void shouldFallBackToHistoricalMean() {
        // Given: token 與呼叫數都固定
        List<AllocatedRecord> history = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            history.add(record(i, "POS-3", "1138", i, 100, 2));
        }

        // When
        DevicePrediction prediction = service.predict(history, List.of(event("POS-3", 999))).get(0);

        // Then
        assertThat(prediction.predictor()).isEqualTo(Predictor.HISTORICAL_MEAN);
        assertThat(prediction.predictedCost()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void shouldSkipDevicesWithShortOrFlatHistory() {
        // Given: POS-4 只有 3 筆，POS-5 成本沒有變異
        List<AllocatedRecord> history = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            history.add(record(i, "POS-4", "1138", i, i * 100L, 1));
        }
        for (int i = 1; i <= 5; i++) {
            history.add(record(i, "POS-5", "1138", 2.0, i * 100L, 1));
        }
        List<TelemetryEvent> current = List.of(event("POS-4", 100), event("POS-5", 100), event("POS-6", 100));

        // When & Then
        assertThat(service.predict(history, current)).isEmpty();
    }

    @Test
    void shouldReturnEmptyWithoutHistoryOrCurrentUsage() {
        assertThat(service.predict(List.of(), List.of(event("POS-1", 1)))).isEmpty();
        assertThat(service.predict(List.of(record(1, "POS-1", "1138", 1, 1, 1)), List.of())).isEmpty();
    }

    private static TelemetryEvent event(String device, long tokens) {
        return new TelemetryEvent(NOW, device, "1138", "store-ai", tokens, 200, 100.0);
    }
}
