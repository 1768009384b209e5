/**
 * Command-line batch job around the core detectors.
 *
 * <p>
 * This package reads one JSON series, runs every configured detector over
 * it and writes a JSON report to standard output.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.seasonalesd.batch.SeasonalEsdBatchJob}: main entry
 * point</li>
 * <li>{@link com.seasonalesd.batch.DetectionRunner}: per-detector error
 * isolation</li>
 * <li>{@link com.seasonalesd.batch.BatchConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.seasonalesd.batch;
