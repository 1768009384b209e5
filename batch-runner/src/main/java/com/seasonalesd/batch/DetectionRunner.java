package com.seasonalesd.batch;

import com.seasonalesd.core.detection.AnomalyDetector;
import com.seasonalesd.core.detection.DetectorFactory;
import com.seasonalesd.core.model.AnomalyReport;
import com.seasonalesd.core.model.DetectorConfig;
import com.seasonalesd.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs every configured detector over one series.
 *
 * <p>
 * Detectors are independent: an exception from one of them is logged,
 * recorded as a {@link DetectorFailure} and the run continues with the next
 * detector.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionRunner {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionRunner.class);

    private final List<AnomalyDetector> detectors;
    private final Clock clock;

    /**
     * @param configs the detector configurations; must not be {@code null} or
     *                empty
     * @throws NullPointerException     if {@code configs} is {@code null}
     * @throws IllegalArgumentException if {@code configs} is empty or a
     *                                  detector cannot be created
     */
    public DetectionRunner(List<DetectorConfig> configs) {
        this(new DetectorFactory().createAll(requireNonEmpty(configs)), Clock.systemUTC());
    }

    DetectionRunner(List<AnomalyDetector> detectors, Clock clock) {
        this.detectors = List.copyOf(detectors);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    /**
     * @param input  name of the input, echoed in the result
     * @param series the series to test
     * @return reports and failures, one entry per detector
     */
    public BatchResult run(String input, TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        long startNanos = System.nanoTime();

        List<AnomalyReport> reports = new ArrayList<>();
        List<DetectorFailure> failures = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            try {
                AnomalyReport report = detector.detect(series);
                reports.add(report);
                LOG.info("Detector [{}] reported {} anomaly(ies)", detector.getName(),
                        report.getAnomalies().size());
            } catch (RuntimeException e) {
                LOG.error("Detector [{}] threw an exception, continuing with next detector",
                        detector.getName(), e);
                failures.add(new DetectorFailure(detector.getName(), e.getMessage()));
            }
        }

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        LOG.info("Ran {} detector(s) over {} observation(s) in {} ms", detectors.size(), series.size(),
                durationMs);
        return new BatchResult(Instant.now(clock), input, series.size(), reports, failures);
    }

    public int detectorCount() {
        return detectors.size();
    }

    private static List<DetectorConfig> requireNonEmpty(List<DetectorConfig> configs) {
        Objects.requireNonNull(configs, "Detector configuration list must not be null");
        if (configs.isEmpty()) {
            throw new IllegalArgumentException("Detector configuration list must not be empty");
        }
        return configs;
    }
}
