package com.spectralsentinel.batch;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.spectralsentinel.core.model.TimePoint;
import com.spectralsentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads a {@link TimeSeries} from JSON.
 *
 * <p>
 * Expected input: an array of objects, each with an ISO-8601
 * {@code timestamp} and a numeric {@code value}. Unknown properties are
 * ignored.
 * </p>
 *
 * <pre>
 * [
 *   {"timestamp": "2024-01-01T00:00:00Z", "value": 1.0},
 *   {"timestamp": "2024-01-01T00:01:00Z", "value": 1.2}
 * ]
 * </pre>
 *
 * <p>
 * Unlike a streaming source, a batch run cannot skip a bad record without
 * shifting every later point, so malformed input fails the whole read.
 * </p>
 */
public class SeriesReader {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesReader.class);

    private static final TypeReference<List<TimePoint>> POINTS = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public SeriesReader() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, true);
        mapper.configure(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES, true);
        mapper.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
    }

    /**
     * @param path JSON file to read
     * @return the parsed series
     * @throws IllegalArgumentException if the file is missing or its content is
     *                                  not a valid series
     * @throws UncheckedIOException     if reading fails
     */
    public TimeSeries read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            TimeSeries series = read(in);
            LOG.info("Read {} points from {}", series.size(), path);
            return series;
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Series file not found: " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read series file: " + path, e);
        }
    }

    /**
     * @param in JSON input; not closed by this method
     * @return the parsed series
     * @throws IllegalArgumentException if the content is not a valid series
     * @throws IOException              if reading fails
     */
    public TimeSeries read(InputStream in) throws IOException {
        Objects.requireNonNull(in, "input must not be null");
        List<TimePoint> points;
        try {
            points = mapper.readValue(in, POINTS);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed series: " + e.getOriginalMessage(), e);
        }
        if (points == null) {
            throw new IllegalArgumentException("Malformed series: expected a JSON array, got null");
        }
        return new TimeSeries(points);
    }
}
