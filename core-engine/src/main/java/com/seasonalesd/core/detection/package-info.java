/**
 * Seasonal-Hybrid ESD anomaly detection.
 *
 * <p>
 * {@link com.seasonalesd.core.detection.SeasonalHybridEsd} is the core
 * entry point: it runs the
 * {@link com.seasonalesd.core.detection.SeasonalPreprocessor} and then the
 * {@link com.seasonalesd.core.detection.IterativeEsdTester} over one series.
 * </p>
 *
 * <p>
 * Configured detectors implement
 * {@link com.seasonalesd.core.detection.AnomalyDetector} and are created via
 * {@link com.seasonalesd.core.detection.DetectorFactory}, one per
 * {@link com.seasonalesd.core.detection.DetectorType}:
 * </p>
 * <ul>
 * <li>{@link com.seasonalesd.core.detection.VectorAnomalyDetector}: ordinal
 * series with an explicit period</li>
 * <li>{@link com.seasonalesd.core.detection.TimeSeriesAnomalyDetector}:
 * date/time series, period from granularity</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.seasonalesd.core.detection;
