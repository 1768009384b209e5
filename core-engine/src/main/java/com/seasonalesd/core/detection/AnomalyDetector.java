package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.AnomalyReport;
import com.seasonalesd.core.model.TimeSeries;

/**
 * Contract for all configured anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong> between calls: each call to
 * {@link #detect(TimeSeries)} works on its own copy of the data, so a single
 * instance may serve concurrent callers.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Run detection over a complete series.
     *
     * @param series the series to examine
     * @return the anomalies found, ordered by timestamp
     */
    AnomalyReport detect(TimeSeries series);

    /**
     * Return the configured name of this detector.
     *
     * @return detector name
     */
    String getName();
}
