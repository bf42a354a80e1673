package io.github.samzhu.finops.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.finops.dto.NormalizedTelemetry;
import io.github.samzhu.finops.dto.TelemetryAggregate;
import io.github.samzhu.finops.dto.TelemetryEvent;
import io.github.samzhu.finops.dto.TelemetryEventData;

class TelemetryWindowingServiceTest {

    private static final Duration HOUR = Duration.ofHours(1);
    private static final String RESOURCE_URL = "https://store-ai.openai.azure.com/openai/deployments/gpt-4o";

    private TelemetryWindowingService service;

    @BeforeEach
    void setUp() {
        service = new TelemetryWindowingService();
    }

    @Test
    void shouldNormalizeAttributesAndResource() {
        // Given
        TelemetryEventData raw = event("r1", "2025-01-15T10:05:00Z", " POS-1 ", "None", "120", "200", "45.5");

        // When
        NormalizedTelemetry result = service.normalize(List.of(raw));

        // Then
        assertThat(result.malformedCount()).isZero();
        TelemetryEvent event = result.events().get(0);
        assertThat(event.deviceId()).isEqualTo("POS-1");
        assertThat(event.storeNumber()).isEqualTo("unknown");
        assertThat(event.resourceId()).isEqualTo("store-ai");
        assertThat(event.tokensUsed()).isEqualTo(120);
        assertThat(event.statusCode()).isEqualTo(200);
        assertThat(event.responseTimeMs()).isEqualTo(45.5);
    }

    @Test
    void shouldCoerceUnparseableNumbersAndCountMalformed() {
        // Given: tokens 無法解析，status 缺漏 (缺漏不算異常)
        TelemetryEventData raw = event("r1", "2025-01-15T10:05:00Z", "POS-1", "1138", "abc", null, "10");

        // When
        NormalizedTelemetry result = service.normalize(List.of(raw));

        // Then
        assertThat(result.events()).hasSize(1);
        assertThat(result.events().get(0).tokensUsed()).isZero();
        assertThat(result.events().get(0).statusCode()).isZero();
        assertThat(result.malformedCount()).isEqualTo(1);
    }

    @Test
    void shouldDropEventsWithoutTimestamp() {
        // Given
        TelemetryEventData missingTime = event("r1", null, "POS-1", "1138", "100", "200", "10");
        TelemetryEventData valid = event("r2", "2025-01-15T10:05:00Z", "POS-1", "1138", "100", "200", "10");

        // When
        NormalizedTelemetry result = service.normalize(Arrays.asList(missingTime, valid, null));

        // Then
        assertThat(result.events()).hasSize(1);
        assertThat(result.malformedCount()).isEqualTo(2);
    }

    @Test
    void shouldAggregatePerWindowResourceDeviceAndStore() {
        // Given: 兩筆落在同一窗口，一筆在下一個窗口
        List<TelemetryEvent> events = service.normalize(List.of(
            event("r1", "2025-01-15T10:05:00Z", "POS-1", "1138", "100", "200", "10"),
            event("r2", "2025-01-15T10:55:00Z", "POS-1", "1138", "300", "200", "30"),
            event("r3", "2025-01-15T11:00:00Z", "POS-1", "1138", "50", "200", "5")
        )).events();

        // When
        List<TelemetryAggregate> aggregates = service.aggregateTelemetry(events, HOUR);

        // Then
        assertThat(aggregates).hasSize(2);
        TelemetryAggregate first = aggregates.get(0);
        assertThat(first.window().start()).isEqualTo(Instant.parse("2025-01-15T10:00:00Z"));
        assertThat(first.totalTokens()).isEqualTo(400);
        assertThat(first.apiCallCount()).isEqualTo(2);
        assertThat(first.avgResponseTimeMs()).isEqualTo(20.0);
        assertThat(aggregates.get(1).window().start()).isEqualTo(Instant.parse("2025-01-15T11:00:00Z"));
    }

    @Test
    void shouldSortAggregatesDeterministically() {
        // Given
        List<TelemetryEvent> events = service.normalize(List.of(
            event("r1", "2025-01-15T10:05:00Z", "POS-2", "1138", "1", "200", "1"),
            event("r2", "2025-01-15T10:06:00Z", "POS-1", "1138", "1", "200", "1")
        )).events();

        // When
        List<TelemetryAggregate> aggregates = service.aggregateTelemetry(events, HOUR);

        // Then
        assertThat(aggregates).extracting(TelemetryAggregate::deviceId).containsExactly("POS-1", "POS-2");
    }

    @Test
    void shouldReturnEmptyAggregatesForEmptyInput() {
        assertThat(service.aggregateTelemetry(List.of(), HOUR)).isEmpty();
    }

    private static TelemetryEventData event(String requestId, String time, String device, String store,
                                            String tokens, String status, String responseTime) {
        return new TelemetryEventData(requestId, time == null ? null : Instant.parse(time), device, store,
            RESOURCE_URL, "chat-completions", tokens, status, responseTime);
    }
}
