package io.github.samzhu.finops.dto;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;

import org.junit.jupiter.api.Test;

class CostEventTest {

    private static final String RESOURCE =
        "/subscriptions/sub-1/resourceGroups/rg-retail/providers/Microsoft.CognitiveServices/accounts/Store-AI";

    @Test
    void shouldParseResourcePathParts() {
        // Given
        CostEvent cost = new CostEvent(RESOURCE, Instant.EPOCH, 10.0, 100.0, "USD", "gpt-4o Input Tokens", "Azure OpenAI");

        // When & Then
        assertThat(cost.subscriptionId()).isEqualTo("sub-1");
        assertThat(cost.resourceGroup()).isEqualTo("rg-retail");
        assertThat(cost.resourceName()).isEqualTo("Store-AI");
        assertThat(cost.costType()).isEqualTo("Input Tokens");
        assertThat(cost.modelFamily()).isEqualTo("GPT-4o");
    }

    @Test
    void shouldDefaultCurrencyAndMeter() {
        // Given
        CostEvent cost = new CostEvent(RESOURCE, Instant.EPOCH, 10.0, 0.0, null, " ", null);

        // When & Then
        assertThat(cost.currency()).isEqualTo("USD");
        assertThat(cost.meterName()).isEqualTo("Unknown");
        assertThat(cost.costPerUnit()).isZero();
    }

    @Test
    void shouldComputeCostPerUnit() {
        CostEvent cost = new CostEvent(RESOURCE, Instant.EPOCH, 10.0, 4.0, "USD", "meter", "svc");

        assertThat(cost.costPerUnit()).isEqualTo(2.5);
    }
}
