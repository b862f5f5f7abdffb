package com.spectralsentinel.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig.Builder}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder produces a config with the given values")
    void shouldBuild() {
        JobConfig config = new JobConfig.Builder()
                .inputPath("in.json")
                .outputPath("out/report.json")
                .detectorConfigPath("detector.yml")
                .prettyPrint(true)
                .build();

        assertThat(config.getInputPath()).isEqualTo("in.json");
        assertThat(config.getOutputPath()).isEqualTo("out/report.json");
        assertThat(config.getDetectorConfigPath()).isEqualTo("detector.yml");
        assertThat(config.isPrettyPrint()).isTrue();
    }

    @Test
    @DisplayName("Detector config path defaults to empty")
    void shouldDefaultDetectorConfigPath() {
        JobConfig config = new JobConfig.Builder()
                .inputPath("in.json")
                .outputPath("out.json")
                .detectorConfigPath(null)
                .build();

        assertThat(config.getDetectorConfigPath()).isEmpty();
        assertThat(config.isPrettyPrint()).isFalse();
    }

    @Test
    @DisplayName("Should reject missing paths")
    void shouldRejectMissingPaths() {
        assertThatThrownBy(() -> new JobConfig.Builder().outputPath("out.json").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(JobConfig.ENV_INPUT_PATH);
        assertThatThrownBy(() -> new JobConfig.Builder().inputPath("in.json").outputPath("  ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(JobConfig.ENV_OUTPUT_PATH);
    }

    @Test
    @DisplayName("Should reject writing the report over the input")
    void shouldRejectSamePaths() {
        assertThatThrownBy(() -> new JobConfig.Builder().inputPath("data.json").outputPath("data.json").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("differ");
    }
}
