package io.github.samzhu.finops.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.dto.AllocatedRecord;
import io.github.samzhu.finops.dto.AllocationMethod;
import io.github.samzhu.finops.dto.AllocationResult;
import io.github.samzhu.finops.dto.CostEvent;
import io.github.samzhu.finops.dto.TelemetryEventData;

class AllocationPipelineServiceTest {

    private static final String TELEMETRY_RESOURCE = "https://store-ai.openai.azure.com/openai/deployments/gpt-4o";
    private static final String BILLING_RESOURCE =
        "/subscriptions/sub-1/resourceGroups/rg/providers/Microsoft.CognitiveServices/accounts/store-ai";

    private AllocationPipelineService pipeline;

    @BeforeEach
    void setUp() {
        FinopsProperties properties = FinopsProperties.defaults();
        pipeline = new AllocationPipelineService(
            new TelemetryWindowingService(),
            new CostCorrelationService(),
            new CostAllocationService(properties),
            new AllocationEnrichmentService(),
            properties);
    }

    @Test
    void shouldAllocateCostEndToEnd() {
        // Given: 同一小時兩台裝置，成本 10
        List<TelemetryEventData> telemetry = List.of(
            event("r1", "2025-01-15T10:05:00Z", "POS-1", "400"),
            event("r2", "2025-01-15T10:15:00Z", "POS-1", "200"),
            event("r3", "2025-01-15T10:20:00Z", "POS-2", "400"));
        List<CostEvent> costs = List.of(cost("2025-01-15T10:00:00Z", 10.0));

        // When
        AllocationResult result = pipeline.run(telemetry, costs, AllocationMethod.PROPORTIONAL);

        // Then
        assertThat(result.records()).hasSize(2);
        assertThat(result.correlatedGroups()).isEqualTo(1);
        assertThat(result.conservationViolations()).isZero();
        assertThat(result.totalAllocatedCost()).isCloseTo(10.0, within(1e-9));
        AllocatedRecord first = result.records().get(0);
        assertThat(first.deviceId()).isEqualTo("POS-1");
        assertThat(first.allocatedCost()).isCloseTo(6.0, within(1e-9));
        assertThat(first.apiCalls()).isEqualTo(2);
        assertThat(first.method()).isEqualTo(AllocationMethod.PROPORTIONAL);
    }

    @Test
    void shouldProduceIdenticalOutputForIdenticalInput() {
        // Given
        List<TelemetryEventData> telemetry = List.of(
            event("r1", "2025-01-15T10:05:00Z", "POS-2", "100"),
            event("r2", "2025-01-15T10:06:00Z", "POS-1", "300"));
        List<CostEvent> costs = List.of(cost("2025-01-15T10:30:00Z", 4.0));

        // When
        AllocationResult first = pipeline.run(telemetry, costs, AllocationMethod.TOKEN_BASED);
        AllocationResult second = pipeline.run(telemetry, costs, AllocationMethod.TOKEN_BASED);

        // Then
        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldReturnEmptyResultWhenCostsMissing() {
        // Given
        List<TelemetryEventData> telemetry = List.of(event("r1", "2025-01-15T10:05:00Z", "POS-1", "100"));

        // When
        AllocationResult result = pipeline.run(telemetry, List.of(), AllocationMethod.EQUAL);

        // Then
        assertThat(result.isEmpty()).isTrue();
        assertThat(result.telemetryEvents()).isEqualTo(1);
    }

    @Test
    void shouldReturnEmptyResultWhenWindowsDoNotAlign() {
        // Given: 遙測 10:00 窗口，成本 11:00 窗口
        List<TelemetryEventData> telemetry = List.of(event("r1", "2025-01-15T10:05:00Z", "POS-1", "100"));
        List<CostEvent> costs = List.of(cost("2025-01-15T11:00:00Z", 5.0));

        // When
        AllocationResult result = pipeline.run(telemetry, costs, AllocationMethod.PROPORTIONAL);

        // Then
        assertThat(result.isEmpty()).isTrue();
        assertThat(result.correlatedGroups()).isZero();
    }

    @Test
    void shouldCountMalformedTelemetryAndCostRows() {
        // Given: 一筆遙測缺少時間，一筆成本缺少時間
        List<TelemetryEventData> telemetry = List.of(
            event("r1", null, "POS-1", "100"),
            event("r2", "2025-01-15T10:05:00Z", "POS-1", "100"));
        List<CostEvent> costs = List.of(cost(null, 1.0), cost("2025-01-15T10:00:00Z", 5.0));

        // When
        AllocationResult result = pipeline.run(telemetry, costs, AllocationMethod.EQUAL);

        // Then
        assertThat(result.malformedRecords()).isEqualTo(2);
        assertThat(result.records()).hasSize(1);
        assertThat(result.records().get(0).allocatedCost()).isEqualTo(5.0);
    }

    private static TelemetryEventData event(String requestId, String time, String device, String tokens) {
        return new TelemetryEventData(requestId, time == null ? null : Instant.parse(time), device, "1138",
            TELEMETRY_RESOURCE, "chat-completions", tokens, "200", "100");
    }

    private static CostEvent cost(String time, double amount) {
        return new CostEvent(BILLING_RESOURCE, time == null ? null : Instant.parse(time), amount, 1000, "USD",
            "gpt-4o Input Tokens", "Azure OpenAI");
    }
}
