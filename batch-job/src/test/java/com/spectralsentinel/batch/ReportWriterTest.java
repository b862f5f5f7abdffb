package com.spectralsentinel.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spectralsentinel.core.model.AnomalyRecord;
import com.spectralsentinel.core.model.AnomalyReport;
import com.spectralsentinel.core.model.DetectMode;
import com.spectralsentinel.core.model.MarginAnomalyRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReportWriter}.
 */
class ReportWriterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static AnomalyRecord record(int id, double value, boolean anomaly) {
        return AnomalyRecord.builder()
                .id(id)
                .timestamp(Instant.parse("2024-01-01T00:00:00Z").plusSeconds(60L * id))
                .value(value)
                .mag(0.05)
                .score(anomaly ? 0.7 : 0.0)
                .anomaly(anomaly)
                .build();
    }

    @Test
    @DisplayName("AnomalyOnly report has the basic columns only")
    void shouldWriteAnomalyOnlyReport() throws IOException {
        AnomalyReport report = new AnomalyReport(DetectMode.ANOMALY_ONLY,
                List.of(record(0, 1.0, false), record(1, 42.0, true)));

        JsonNode root = MAPPER.readTree(new ReportWriter(false).writeAsString(report));

        assertThat(root.get("detectMode").asText()).isEqualTo("AnomalyOnly");
        JsonNode second = root.get("records").get(1);
        assertThat(second.get("id").asInt()).isEqualTo(1);
        assertThat(second.get("timestamp").asText()).isEqualTo("2024-01-01T00:01:00Z");
        assertThat(second.get("value").asDouble()).isEqualTo(42.0);
        assertThat(second.get("score").asDouble()).isEqualTo(0.7);
        assertThat(second.get("isAnomaly").asBoolean()).isTrue();
        assertThat(second.has("expectedValue")).isFalse();
        assertThat(root.has("anomalyIds")).isFalse();
    }

    @Test
    @DisplayName("Margin report adds expected value and boundaries")
    void shouldWriteMarginReport() throws IOException {
        AnomalyReport report = new AnomalyReport(DetectMode.ANOMALY_AND_MARGIN,
                List.of(MarginAnomalyRecord.of(record(0, 3.0, true), 1.0, 0.0, 4.0)));

        JsonNode record = MAPPER.readTree(new ReportWriter(true).writeAsString(report)).get("records").get(0);

        assertThat(record.get("expectedValue").asDouble()).isEqualTo(1.0);
        assertThat(record.get("lowerBoundary").asDouble()).isEqualTo(0.0);
        assertThat(record.get("upperBoundary").asDouble()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Writing to a path creates missing parent directories")
    void shouldCreateParentDirectories(@TempDir Path dir) throws IOException {
        Path target = dir.resolve("nested/out/report.json");
        AnomalyReport report = new AnomalyReport(DetectMode.ANOMALY_ONLY, List.of(record(0, 1.0, false)));

        new ReportWriter(false).write(report, target);

        assertThat(target).exists();
        assertThat(MAPPER.readTree(Files.readString(target)).get("records").size()).isEqualTo(1);
    }
}
