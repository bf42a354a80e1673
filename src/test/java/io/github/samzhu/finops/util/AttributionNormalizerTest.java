package io.github.samzhu.finops.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AttributionNormalizerTest {

    @Test
    void shouldExtractLastSegmentFromResourcePath() {
        // Given
        String path = "/subscriptions/abc/resourceGroups/rg-retail/providers/Microsoft.CognitiveServices/accounts/Store-AI";

        // When & Then: 路徑轉小寫後取最後一段
        assertThat(AttributionNormalizer.normalizeResourceId(path)).isEqualTo("store-ai");
    }

    @Test
    void shouldIgnoreTrailingSlashInResourcePath() {
        assertThat(AttributionNormalizer.normalizeResourceId("/subscriptions/abc/accounts/store-ai/"))
            .isEqualTo("store-ai");
    }

    @Test
    void shouldExtractFirstHostLabelFromUrl() {
        // Given
        String url = "https://store-ai.openai.azure.com/openai/deployments/gpt-4o/chat/completions";

        // When & Then
        assertThat(AttributionNormalizer.normalizeResourceId(url)).isEqualTo("store-ai");
    }

    @Test
    void shouldMatchTelemetryAndBillingRepresentations() {
        // Given: 同一資源的兩種表示
        String billing = "/subscriptions/abc/resourceGroups/rg/providers/x/accounts/store-ai";
        String telemetry = "https://STORE-AI.openai.azure.com/openai";

        // When & Then
        assertThat(AttributionNormalizer.normalizeResourceId(billing))
            .isEqualTo(AttributionNormalizer.normalizeResourceId(telemetry));
    }

    @Test
    void shouldReturnUnknownForMissingResource() {
        assertThat(AttributionNormalizer.normalizeResourceId(null)).isEqualTo("unknown");
        assertThat(AttributionNormalizer.normalizeResourceId("  ")).isEqualTo("unknown");
        assertThat(AttributionNormalizer.normalizeResourceId("UNKNOWN")).isEqualTo("unknown");
    }

    @Test
    void shouldLowercasePlainResourceName() {
        assertThat(AttributionNormalizer.normalizeResourceId(" Store-AI ")).isEqualTo("store-ai");
    }

    @Test
    void shouldBeIdempotent() {
        // Given
        String once = AttributionNormalizer.normalizeResourceId("https://store-ai.openai.azure.com/");

        // When & Then
        assertThat(AttributionNormalizer.normalizeResourceId(once)).isEqualTo(once);
    }

    @Test
    void shouldMapNullLikeAttributesToUnknown() {
        assertThat(AttributionNormalizer.normalizeAttribute(null)).isEqualTo("unknown");
        assertThat(AttributionNormalizer.normalizeAttribute("")).isEqualTo("unknown");
        assertThat(AttributionNormalizer.normalizeAttribute("None")).isEqualTo("unknown");
        assertThat(AttributionNormalizer.normalizeAttribute("null")).isEqualTo("unknown");
        assertThat(AttributionNormalizer.normalizeAttribute(" Unknown ")).isEqualTo("unknown");
    }

    @Test
    void shouldTrimKnownAttribute() {
        assertThat(AttributionNormalizer.normalizeAttribute(" POS-0042 ")).isEqualTo("POS-0042");
    }

    @Test
    void shouldParseNonNegativeNumbers() {
        assertThat(AttributionNormalizer.parseNonNegative("120")).hasValue(120.0);
        assertThat(AttributionNormalizer.parseNonNegative(" 45.5 ")).hasValue(45.5);
    }

    @Test
    void shouldRejectInvalidNumbers() {
        assertThat(AttributionNormalizer.parseNonNegative("abc")).isEmpty();
        assertThat(AttributionNormalizer.parseNonNegative("-3")).isEmpty();
        assertThat(AttributionNormalizer.parseNonNegative("NaN")).isEmpty();
        assertThat(AttributionNormalizer.parseNonNegative("")).isEmpty();
        assertThat(AttributionNormalizer.parseNonNegative(null)).isEmpty();
    }
}
