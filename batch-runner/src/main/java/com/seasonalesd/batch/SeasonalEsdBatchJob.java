package com.seasonalesd.batch;

import com.seasonalesd.core.config.DetectorsConfig;
import com.seasonalesd.core.config.DetectorsLoader;
import com.seasonalesd.core.model.DetectorConfig;
import com.seasonalesd.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.List;

/**
 * Main entry point for the batch detection job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   JSON series (file or stdin)
 *     → SeriesReader → TimeSeries
 *     → DetectionRunner (runs all configured detectors)
 *     → ReportSerializer → JSON
 *     → stdout
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link BatchConfig}; the first argument overrides the input path. Logs go
 * to standard error so that standard output carries only the report.
 * </p>
 *
 * <h3>Exit status</h3>
 * <p>
 * {@code 0} when every detector produced a report, {@code 2} when at least
 * one failed. Invalid configuration or input aborts with an exception.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalEsdBatchJob {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalEsdBatchJob.class);

    static final int EXIT_DETECTOR_FAILED = 2;

    private SeasonalEsdBatchJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws IOException {
        // 1. Load configuration
        BatchConfig config = BatchConfig.fromEnvironment().withArguments(args);
        LOG.info("Starting batch detection with config: {}", config);

        int status = run(config, System.in, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Run one batch: load detectors, read the series, detect and print.
     *
     * @return process exit status
     * @throws IOException           if the input cannot be read
     * @throws IllegalStateException if no detectors are configured
     */
    static int run(BatchConfig config, InputStream stdin, PrintStream out) throws IOException {
        // 2. Load detectors
        List<DetectorConfig> detectors = loadDetectors(config).getDetectors();
        if (detectors.isEmpty()) {
            throw new IllegalStateException(
                    "No detectors defined. Provide detectors via "
                            + DetectorsLoader.ENV_DETECTORS_PATH
                            + " or a classpath " + DetectorsLoader.DEFAULT_RESOURCE + " file.");
        }
        DetectionRunner runner = new DetectionRunner(detectors);

        // 3. Read the series
        TimeSeries series = readSeries(config, stdin);

        // 4. Detect and print
        BatchResult result = runner.run(config.getInputPath(), series);
        out.println(new ReportSerializer(config.isPrettyPrint()).serialize(result));

        if (!result.getFailures().isEmpty()) {
            LOG.warn("{} of {} detector(s) failed", result.getFailures().size(), runner.detectorCount());
            return EXIT_DETECTOR_FAILED;
        }
        return 0;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DetectorsConfig loadDetectors(BatchConfig config) {
        String detectorsPath = config.getDetectorsConfigPath();
        if (detectorsPath != null && !detectorsPath.isBlank()) {
            return DetectorsLoader.fromFile(detectorsPath);
        }
        return DetectorsLoader.load();
    }

    private static TimeSeries readSeries(BatchConfig config, InputStream stdin) throws IOException {
        SeriesReader reader = new SeriesReader(config.getTimestampField(), config.getValueField());
        if (config.isStdin()) {
            return reader.read(stdin);
        }
        try (InputStream is = new FileInputStream(config.getInputPath())) {
            return reader.read(is);
        }
    }
}
