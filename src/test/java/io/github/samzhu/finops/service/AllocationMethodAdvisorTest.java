package io.github.samzhu.finops.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.finops.dto.AllocationMethod;
import io.github.samzhu.finops.dto.CostEvent;
import io.github.samzhu.finops.dto.MethodRecommendation;
import io.github.samzhu.finops.dto.TelemetryEvent;

class AllocationMethodAdvisorTest {

    private static final Instant T = Instant.parse("2025-01-15T10:00:00Z");
    private static final List<CostEvent> COSTS = List.of(
        new CostEvent("/subscriptions/s/accounts/store-ai", T, 10.0, 1000, "USD", "gpt-4o Input Tokens", "Azure OpenAI"));

    private AllocationMethodAdvisor advisor;

    @BeforeEach
    void setUp() {
        advisor = new AllocationMethodAdvisor();
    }

    @Test
    void shouldRecommendEqualWithoutData() {
        // When
        MethodRecommendation recommendation = advisor.recommend(List.of(), COSTS);

        // Then
        assertThat(recommendation.method()).isEqualTo(AllocationMethod.EQUAL);
        assertThat(recommendation.reason()).isEqualTo("No data available");
    }

    @Test
    void shouldRecommendEqualWhenMostDevicesUnknown() {
        // Given: 4 筆中 3 筆未知裝置
        List<TelemetryEvent> telemetry = List.of(
            event("unknown", 100), event("unknown", 100), event("unknown", 100), event("POS-1", 100));

        // When
        MethodRecommendation recommendation = advisor.recommend(telemetry, COSTS);

        // Then
        assertThat(recommendation.method()).isEqualTo(AllocationMethod.EQUAL);
        assertThat(recommendation.unknownDeviceRatio()).isEqualTo(0.75);
    }

    @Test
    void shouldRecommendTokenBasedForSkewedTokens() {
        // Given
        List<TelemetryEvent> telemetry = List.of(
            event("POS-1", 10), event("POS-2", 10), event("POS-3", 10), event("POS-4", 5000));

        // When
        MethodRecommendation recommendation = advisor.recommend(telemetry, COSTS);

        // Then
        assertThat(recommendation.method()).isEqualTo(AllocationMethod.TOKEN_BASED);
        assertThat(recommendation.tokenVariation()).isGreaterThan(2.0);
    }

    @Test
    void shouldRecommendUsageBasedForSkewedCalls() {
        // Given: POS-1 10 次呼叫，POS-2 1 次，token 相同
        List<TelemetryEvent> telemetry = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            telemetry.add(event("POS-1", 100));
        }
        telemetry.add(event("POS-2", 100));

        // When
        MethodRecommendation recommendation = advisor.recommend(telemetry, COSTS);

        // Then
        assertThat(recommendation.method()).isEqualTo(AllocationMethod.USAGE_BASED);
        assertThat(recommendation.callVariation()).isGreaterThan(1.5);
        assertThat(recommendation.deviceCount()).isEqualTo(2);
    }

    @Test
    void shouldRecommendProportionalForBalancedUsage() {
        // Given
        List<TelemetryEvent> telemetry = List.of(
            event("POS-1", 100), event("POS-1", 100), event("POS-2", 100), event("POS-2", 100));

        // When
        MethodRecommendation recommendation = advisor.recommend(telemetry, COSTS);

        // Then
        assertThat(recommendation.method()).isEqualTo(AllocationMethod.PROPORTIONAL);
        assertThat(recommendation.reason()).isEqualTo("Balanced usage patterns");
    }

    @Test
    void shouldRecommendProportionalForLargeFleet() {
        // Given: 11 台裝置，用量一致
        List<TelemetryEvent> telemetry = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            telemetry.add(event("POS-" + i, 100));
        }

        // When
        MethodRecommendation recommendation = advisor.recommend(telemetry, COSTS);

        // Then
        assertThat(recommendation.method()).isEqualTo(AllocationMethod.PROPORTIONAL);
        assertThat(recommendation.reason()).isEqualTo("Large number of devices with moderate variance");
    }

    private static TelemetryEvent event(String device, long tokens) {
        return new TelemetryEvent(T, device, "1138", "store-ai", tokens, 200, 100.0);
    }
}
