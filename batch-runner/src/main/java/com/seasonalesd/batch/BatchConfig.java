package com.seasonalesd.batch;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the batch detection job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults so
 * the job can be driven from a shell, a cron entry or a container
 * {@code -e} flag. The first command-line argument, when given, replaces
 * {@code INPUT_PATH}.
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
public final class BatchConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Input path meaning "read standard input". */
    public static final String STDIN = "-";

    // ---------------------------------------------------------------
    // Input
    // ---------------------------------------------------------------
    private final String inputPath;
    private final String timestampField;
    private final String valueField;

    // ---------------------------------------------------------------
    // Detectors
    // ---------------------------------------------------------------
    private final String detectorsConfigPath;

    // ---------------------------------------------------------------
    // Output
    // ---------------------------------------------------------------
    private final boolean prettyPrint;

    private BatchConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.timestampField = b.timestampField;
        this.valueField = b.valueField;
        this.detectorsConfigPath = b.detectorsConfigPath;
        this.prettyPrint = b.prettyPrint;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link BatchConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalArgumentException if a validated field is blank
     */
    public static BatchConfig fromEnvironment() {
        return new Builder()
                .inputPath(env("INPUT_PATH", STDIN))
                .detectorsConfigPath(env("DETECTORS_CONFIG_PATH", ""))
                .timestampField(env("TIMESTAMP_FIELD", "timestamp"))
                .valueField(env("VALUE_FIELD", "value"))
                .prettyPrint(Boolean.parseBoolean(env("PRETTY_PRINT", "false")))
                .build();
    }

    /**
     * Apply command-line arguments on top of this configuration.
     *
     * @param args program arguments; the first one, if present, is the input path
     * @return this configuration, or a copy with the input path replaced
     */
    public BatchConfig withArguments(String[] args) {
        Objects.requireNonNull(args, "args must not be null");
        if (args.length == 0) {
            return this;
        }
        return toBuilder().inputPath(args[0]).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .inputPath(inputPath)
                .detectorsConfigPath(detectorsConfigPath)
                .timestampField(timestampField)
                .valueField(valueField)
                .prettyPrint(prettyPrint);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getInputPath() {
        return inputPath;
    }

    public boolean isStdin() {
        return STDIN.equals(inputPath);
    }

    public String getTimestampField() {
        return timestampField;
    }

    public String getValueField() {
        return valueField;
    }

    public String getDetectorsConfigPath() {
        return detectorsConfigPath;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link BatchConfig}.
     *
     * <p>
     * The {@link #build()} method validates that the input path and field
     * names are non-blank and that the two field names differ.
     * </p>
     */
    public static class Builder {
        private String inputPath = STDIN;
        private String timestampField = "timestamp";
        private String valueField = "value";
        private String detectorsConfigPath = "";
        private boolean prettyPrint;

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder timestampField(String v) {
            this.timestampField = v;
            return this;
        }

        public Builder valueField(String v) {
            this.valueField = v;
            return this;
        }

        public Builder detectorsConfigPath(String v) {
            this.detectorsConfigPath = v;
            return this;
        }

        public Builder prettyPrint(boolean v) {
            this.prettyPrint = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link BatchConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public BatchConfig build() {
            Objects.requireNonNull(detectorsConfigPath, "detectorsConfigPath required");
            requireNonBlank(inputPath, "inputPath");
            requireNonBlank(timestampField, "timestampField");
            requireNonBlank(valueField, "valueField");

            if (timestampField.equals(valueField)) {
                throw new IllegalArgumentException(
                        "timestampField and valueField must differ, both are: " + valueField);
            }

            return new BatchConfig(this);
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
    public String toString() {
        return "BatchConfig{" +
                "inputPath='" + inputPath + '\'' +
                ", timestampField='" + timestampField + '\'' +
                ", valueField='" + valueField + '\'' +
                ", detectorsConfigPath='" + detectorsConfigPath + '\'' +
                ", prettyPrint=" + prettyPrint +
                '}';
    }
}
