package com.spectralsentinel.batch;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.spectralsentinel.core.model.AnomalyReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes an {@link AnomalyReport} as JSON.
 *
 * <p>
 * Output shape: {@code {"detectMode": "...", "records": [...]}} with ISO-8601
 * timestamps. Margin-mode records additionally carry {@code expectedValue},
 * {@code lowerBoundary} and {@code upperBoundary}.
 * </p>
 */
public class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper mapper;

    public ReportWriter(boolean prettyPrint) {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, prettyPrint);
    }

    /**
     * Write the report to {@code path}, creating parent directories as needed
     * and replacing any existing file.
     *
     * @throws UncheckedIOException if writing fails
     */
    public void write(AnomalyReport report, Path path) {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(path, "path must not be null");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(path)) {
                write(report, out);
            }
            LOG.info("Wrote report with {} records to {}", report.size(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report to " + path, e);
        }
    }

    /**
     * @param out destination; not closed by this method
     */
    public void write(AnomalyReport report, OutputStream out) throws IOException {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(out, "output must not be null");
        mapper.writeValue(out, report);
    }

    /**
     * @return the report as a JSON string
     */
    public String writeAsString(AnomalyReport report) throws IOException {
        return mapper.writeValueAsString(Objects.requireNonNull(report, "report must not be null"));
    }
}
