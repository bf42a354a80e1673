package io.github.samzhu.finops.collector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.BulkOperations.BulkMode;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import com.mongodb.bulk.BulkWriteResult;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.config.FinopsProperties.CollectionConfig;
import io.github.samzhu.finops.document.AllocatedCost;
import io.github.samzhu.finops.document.RawCostBatch;
import io.github.samzhu.finops.dto.AllocatedRecord;
import io.github.samzhu.finops.dto.AllocationMethod;
import io.github.samzhu.finops.dto.CostAllocation;
import io.github.samzhu.finops.dto.CostEvent;
import io.github.samzhu.finops.dto.TimeWindow;
import io.github.samzhu.finops.repository.RawCostBatchRepository;
import io.github.samzhu.finops.service.AllocationEnrichmentService;

class MongoAllocationSinkTest {

    private static final Instant NOW = Instant.parse("2025-01-15T12:00:00Z");
    private static final Instant WINDOW_START = Instant.parse("2025-01-15T10:00:00Z");
    private static final CostEvent COST = new CostEvent(
        "/subscriptions/s/accounts/store-ai", WINDOW_START, 10.0, 1000, "USD", "gpt-4o Input Tokens", "Azure OpenAI");

    private MongoTemplate mongoTemplate;
    private BulkOperations bulkOps;
    private RawCostBatchRepository rawCostBatchRepository;
    private MongoAllocationSink sink;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        bulkOps = mock(BulkOperations.class);
        rawCostBatchRepository = mock(RawCostBatchRepository.class);
        BulkWriteResult result = mock(BulkWriteResult.class);
        when(result.getUpserts()).thenReturn(List.of());
        when(mongoTemplate.bulkOps(BulkMode.UNORDERED, AllocatedCost.class)).thenReturn(bulkOps);
        when(bulkOps.execute()).thenReturn(result);

        FinopsProperties properties = new FinopsProperties(
            null,
            new CollectionConfig("0 */6 * * * *", 1, 2, Duration.ofMillis(1), Duration.ofMillis(2)),
            null, null, null, null);
        sink = new MongoAllocationSink(mongoTemplate, rawCostBatchRepository, Clock.fixed(NOW, ZoneOffset.UTC),
            new CollectorRetryFactory(properties));
    }

    @Test
    void shouldUpsertEachRecordAndSaveRawCosts() {
        // Given
        AllocationBatch batch = new AllocationBatch("run-1", LocalDate.of(2025, 1, 15),
            NOW.minus(Duration.ofHours(1)), NOW,
            List.of(record("POS-1", 6.0), record("POS-2", 4.0)), List.of(COST));

        // When
        int written = sink.write(batch);

        // Then
        assertThat(written).isEqualTo(2);
        ArgumentCaptor<AllocatedCost> documents = ArgumentCaptor.forClass(AllocatedCost.class);
        verify(bulkOps, times(2)).replaceOne(any(Query.class), documents.capture(), any(FindAndReplaceOptions.class));
        assertThat(documents.getAllValues())
            .extracting(AllocatedCost::id)
            .containsExactly(
                "2025-01-15T10:00:00Z_store-ai_POS-1_1138",
                "2025-01-15T10:00:00Z_store-ai_POS-2_1138");
        assertThat(documents.getAllValues()).allSatisfy(document -> {
            assertThat(document.runId()).isEqualTo("run-1");
            assertThat(document.createdAt()).isEqualTo(NOW);
        });

        ArgumentCaptor<RawCostBatch> raw = ArgumentCaptor.forClass(RawCostBatch.class);
        verify(rawCostBatchRepository).save(raw.capture());
        assertThat(raw.getValue().runId()).isEqualTo("run-1");
    }

    @Test
    void shouldSkipBulkWriteWithoutRecords() {
        // Given
        AllocationBatch batch = new AllocationBatch("run-1", LocalDate.of(2025, 1, 15),
            NOW.minus(Duration.ofHours(1)), NOW, List.of(), List.of(COST));

        // When
        int written = sink.write(batch);

        // Then
        assertThat(written).isZero();
        verify(mongoTemplate, never()).bulkOps(any(BulkMode.class), eq(AllocatedCost.class));
    }

    @Test
    void shouldThrowAfterRetriesExhausted() {
        // Given
        when(bulkOps.execute()).thenThrow(new DataAccessResourceFailureException("connection refused"));
        AllocationBatch batch = new AllocationBatch("run-1", LocalDate.of(2025, 1, 15),
            NOW.minus(Duration.ofHours(1)), NOW, List.of(record("POS-1", 6.0)), List.of());

        // When & Then
        assertThatThrownBy(() -> sink.write(batch))
            .isInstanceOf(DataAccessResourceFailureException.class);
        verify(bulkOps, times(2)).execute();
    }

    private static AllocatedRecord record(String device, double cost) {
        CostAllocation allocation = new CostAllocation(
            TimeWindow.of(WINDOW_START, Duration.ofHours(1)), "store-ai", device, "1138",
            cost, 10.0, AllocationMethod.PROPORTIONAL, 100, 1, 120.0, 0.5, 0.5,
            "Input Tokens", "GPT-4o", "gpt-4o Input Tokens", "USD");
        return new AllocationEnrichmentService().enrich(allocation);
    }
}
