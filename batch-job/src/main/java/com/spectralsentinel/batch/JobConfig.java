package com.spectralsentinel.batch;

import java.util.Objects;

/**
 * Typed, immutable configuration of the Spectral Sentinel batch job.
 *
 * <p>
 * Values are resolved from environment variables, so the job can be driven
 * from a shell, a container {@code -e} flag or a scheduler definition without
 * code changes.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    /** JSON file holding the input series. */
    public static final String ENV_INPUT_PATH = "SERIES_INPUT_PATH";

    /** Destination of the JSON report. */
    public static final String ENV_OUTPUT_PATH = "REPORT_OUTPUT_PATH";

    /** Optional YAML file with detector parameters. */
    public static final String ENV_DETECTOR_CONFIG_PATH = "DETECTOR_CONFIG_PATH";

    private final String inputPath;
    private final String outputPath;
    private final String detectorConfigPath;
    private final boolean prettyPrint;

    private JobConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath;
        this.detectorConfigPath = b.detectorConfigPath;
        this.prettyPrint = b.prettyPrint;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalArgumentException if a required variable is missing
     */
    public static JobConfig fromEnvironment() {
        return new Builder()
                .inputPath(env(ENV_INPUT_PATH, ""))
                .outputPath(env(ENV_OUTPUT_PATH, ""))
                .detectorConfigPath(env(ENV_DETECTOR_CONFIG_PATH, ""))
                .prettyPrint(Boolean.parseBoolean(env("REPORT_PRETTY_PRINT", "false")))
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getInputPath() {
        return inputPath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    /**
     * @return the detector config path, or an empty string to use automatic
     *         resolution
     */
    public String getDetectorConfigPath() {
        return detectorConfigPath;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} requires non-blank input and output paths that differ
     * from each other.
     * </p>
     */
    public static class Builder {
        private String inputPath;
        private String outputPath;
        private String detectorConfigPath = "";
        private boolean prettyPrint;

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder detectorConfigPath(String v) {
            this.detectorConfigPath = v;
            return this;
        }

        public Builder prettyPrint(boolean v) {
            this.prettyPrint = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(inputPath, "inputPath (" + ENV_INPUT_PATH + ")");
            requireNonBlank(outputPath, "outputPath (" + ENV_OUTPUT_PATH + ")");
            if (inputPath.equals(outputPath)) {
                throw new IllegalArgumentException(
                        "outputPath must differ from inputPath, both are: " + inputPath);
            }
            if (detectorConfigPath == null) {
                detectorConfigPath = "";
            }
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobConfig that))
            return false;
        return prettyPrint == that.prettyPrint
                && inputPath.equals(that.inputPath)
                && outputPath.equals(that.outputPath)
                && detectorConfigPath.equals(that.detectorConfigPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputPath, outputPath, detectorConfigPath, prettyPrint);
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "inputPath='" + inputPath + '\'' +
                ", outputPath='" + outputPath + '\'' +
                ", detectorConfigPath='" + detectorConfigPath + '\'' +
                ", prettyPrint=" + prettyPrint +
                '}';
    }
}
