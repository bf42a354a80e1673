package io.github.samzhu.finops.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MeterClassifierTest {

    @Test
    void shouldClassifyCostType() {
        assertThat(MeterClassifier.costType("gpt-4o Input Tokens")).isEqualTo("Input Tokens");
        assertThat(MeterClassifier.costType("gpt-4o Output Tokens")).isEqualTo("Output Tokens");
        assertThat(MeterClassifier.costType("Provisioned Managed PTU")).isEqualTo("Provisioned Throughput");
        assertThat(MeterClassifier.costType("gpt-35-turbo fine-tuning hosting")).isEqualTo("Fine-tuning");
        assertThat(MeterClassifier.costType("Model Training Hours")).isEqualTo("Training");
        assertThat(MeterClassifier.costType(null)).isEqualTo("Unknown");
    }

    @Test
    void shouldPreferSpecificModelFamily() {
        assertThat(MeterClassifier.modelFamily("gpt-4o-mini Input Tokens")).isEqualTo("GPT-4o");
        assertThat(MeterClassifier.modelFamily("GPT-4 Turbo Output Tokens")).isEqualTo("GPT-4-Turbo");
        assertThat(MeterClassifier.modelFamily("gpt-4 Input Tokens")).isEqualTo("GPT-4");
        assertThat(MeterClassifier.modelFamily("GPT-35-turbo Output Tokens")).isEqualTo("GPT-3.5-Turbo");
        assertThat(MeterClassifier.modelFamily("gpt-5 preview Input Tokens")).isEqualTo("GPT-5-Preview");
        assertThat(MeterClassifier.modelFamily("text-davinci-003")).isEqualTo("Davinci");
        assertThat(MeterClassifier.modelFamily("Provisioned Managed PTU")).isEqualTo("Unknown");
    }

    @Test
    void shouldDetectTokenBasedMeters() {
        assertThat(MeterClassifier.isTokenBased("gpt-4o Input Tokens")).isTrue();
        assertThat(MeterClassifier.isTokenBased("Provisioned Managed PTU")).isFalse();
    }
}
