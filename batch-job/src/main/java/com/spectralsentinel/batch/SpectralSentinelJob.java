package com.spectralsentinel.batch;

import com.spectralsentinel.core.config.DetectorConfig;
import com.spectralsentinel.core.config.DetectorConfigLoader;
import com.spectralsentinel.core.detection.AnomalyDetector;
import com.spectralsentinel.core.detection.DetectorFactory;
import com.spectralsentinel.core.model.AnomalyReport;
import com.spectralsentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Main entry point for the Spectral Sentinel batch job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   JSON series file
 *     → SeriesReader → TimeSeries
 *     → SpectralResidualDetector (parameters from DetectorConfig)
 *     → ReportWriter → JSON report file
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Paths are resolved from environment variables via {@link JobConfig};
 * detector parameters come from the YAML file named by
 * {@value JobConfig#ENV_DETECTOR_CONFIG_PATH}, or from {@code detector.yml} on
 * the classpath when that variable is unset.
 * </p>
 *
 * @since 1.0.0
 */
public final class SpectralSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(SpectralSentinelJob.class);

    private SpectralSentinelJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Spectral Sentinel with config: {}", config);
        run(config);
    }

    /**
     * Run one detection pass as described by {@code config}.
     *
     * @return the report that was written
     */
    static AnomalyReport run(JobConfig config) {
        long startNanos = System.nanoTime();

        DetectorConfig detectorConfig = DetectorConfigLoader.load(config.getDetectorConfigPath());
        TimeSeries series = new SeriesReader().read(Path.of(config.getInputPath()));

        AnomalyDetector detector = DetectorFactory.create(series, detectorConfig);
        AnomalyReport report = detector.detect();

        new ReportWriter(config.isPrettyPrint()).write(report, Path.of(config.getOutputPath()));

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        LOG.info("Finished: {} points, {} anomalies, mode={}, {} ms",
                report.size(), report.getAnomalyCount(), report.getDetectMode().getValue(), durationMs);
        return report;
    }
}
