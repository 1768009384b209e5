package com.seasonalesd.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BatchConfig}.
 */
class BatchConfigTest {

    @Test
    @DisplayName("Should read standard input with default field names by default")
    void shouldApplyDefaults() {
        BatchConfig config = new BatchConfig.Builder().build();

        assertThat(config.isStdin()).isTrue();
        assertThat(config.getTimestampField()).isEqualTo("timestamp");
        assertThat(config.getValueField()).isEqualTo("value");
        assertThat(config.getDetectorsConfigPath()).isEmpty();
        assertThat(config.isPrettyPrint()).isFalse();
    }

    @Test
    @DisplayName("Should let the first argument override the input path")
    void shouldOverrideInputPathFromArguments() {
        BatchConfig config = new BatchConfig.Builder().valueField("count").build();

        BatchConfig overridden = config.withArguments(new String[] { "series.json", "ignored" });

        assertThat(overridden.getInputPath()).isEqualTo("series.json");
        assertThat(overridden.isStdin()).isFalse();
        assertThat(overridden.getValueField()).isEqualTo("count");
        assertThat(config.withArguments(new String[0])).isSameAs(config);
    }

    @Test
    @DisplayName("Should reject blank and clashing field names")
    void shouldRejectInvalidFields() {
        assertThatThrownBy(() -> new BatchConfig.Builder().inputPath(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("inputPath");
        assertThatThrownBy(() -> new BatchConfig.Builder().valueField(null).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("valueField");
        assertThatThrownBy(() -> new BatchConfig.Builder().timestampField("v").valueField("v").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must differ");
    }

    @Test
    @DisplayName("Should resolve a valid configuration from the environment")
    void shouldBuildFromEnvironment() {
        BatchConfig config = BatchConfig.fromEnvironment();

        assertThat(config.getInputPath()).isNotBlank();
        assertThat(config.getTimestampField()).isNotEqualTo(config.getValueField());
    }
}
