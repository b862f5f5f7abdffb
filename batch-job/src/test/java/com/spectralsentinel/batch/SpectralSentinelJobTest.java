package com.spectralsentinel.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spectralsentinel.core.model.AnomalyReport;
import com.spectralsentinel.core.model.DetectMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link SpectralSentinelJob#run(JobConfig)}.
 */
class SpectralSentinelJobTest {

    @TempDir
    Path dir;

    private Path writeSeries(double[] values) throws IOException {
        Instant start = Instant.parse("2024-03-01T00:00:00Z");
        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"timestamp\":\"").append(start.plusSeconds(300L * i))
                    .append("\",\"value\":").append(values[i]).append('}');
        }
        json.append(']');
        Path input = dir.resolve("series.json");
        Files.writeString(input, json);
        return input;
    }

    /** Period-7 sawtooth with a +50 spike at index 23. */
    private static double[] sawtoothWithSpike() {
        double[] values = new double[40];
        for (int i = 0; i < values.length; i++) {
            values[i] = i % 7;
        }
        values[23] += 50.0;
        return values;
    }

    @Test
    @DisplayName("Reads the series, detects with classpath defaults and writes the report")
    void shouldRunWithDefaults() throws IOException {
        Path input = writeSeries(sawtoothWithSpike());
        Path output = dir.resolve("out/report.json");

        AnomalyReport report = SpectralSentinelJob.run(new JobConfig.Builder()
                .inputPath(input.toString())
                .outputPath(output.toString())
                .build());

        assertThat(report.getDetectMode()).isEqualTo(DetectMode.ANOMALY_ONLY);
        assertThat(report.getAnomalyIds()).containsExactly(23);

        JsonNode written = new ObjectMapper().readTree(Files.readString(output));
        assertThat(written.get("records").size()).isEqualTo(40);
        assertThat(written.get("records").get(23).get("isAnomaly").asBoolean()).isTrue();
    }

    @Test
    @DisplayName("Uses the detector config file when one is given")
    void shouldRunWithDetectorConfigFile() throws IOException {
        Path input = writeSeries(sawtoothWithSpike());
        Path detectorConfig = dir.resolve("detector.yml");
        Files.writeString(detectorConfig, "detectMode: AnomalyAndMargin\nsensitivity: 0\n");
        Path output = dir.resolve("report.json");

        AnomalyReport report = SpectralSentinelJob.run(new JobConfig.Builder()
                .inputPath(input.toString())
                .outputPath(output.toString())
                .detectorConfigPath(detectorConfig.toString())
                .prettyPrint(true)
                .build());

        assertThat(report.getDetectMode()).isEqualTo(DetectMode.ANOMALY_AND_MARGIN);
        JsonNode first = new ObjectMapper().readTree(Files.readString(output)).get("records").get(0);
        assertThat(first.has("expectedValue")).isTrue();
        assertThat(first.has("lowerBoundary")).isTrue();
        assertThat(first.has("upperBoundary")).isTrue();
    }

    @Test
    @DisplayName("Fails on a missing input file without writing a report")
    void shouldFailOnMissingInput() {
        Path output = dir.resolve("report.json");
        JobConfig config = new JobConfig.Builder()
                .inputPath(dir.resolve("missing.json").toString())
                .outputPath(output.toString())
                .build();

        assertThatThrownBy(() -> SpectralSentinelJob.run(config))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(output).doesNotExist();
    }
}
