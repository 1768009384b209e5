package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.DetectorConfig;
import com.seasonalesd.core.model.InvalidConfigurationException;
import com.seasonalesd.core.time.TimestampFormatter;
import com.seasonalesd.core.time.UtcTimestampFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds {@link AnomalyDetector}s from detector profiles.
 *
 * <p>
 * Every detector built by one factory shares its {@link SeasonalHybridEsd}
 * engine and {@link TimestampFormatter}; both are stateless. A profile is
 * checked against the rules of its {@link DetectorType} before anything is
 * constructed, so a vector profile without a {@code period} or a timeseries
 * profile with a one-week median window is reported by name rather than
 * failing inside a detector constructor.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private final SeasonalHybridEsd engine;
    private final TimestampFormatter formatter;

    public DetectorFactory() {
        this(new SeasonalHybridEsd(), UtcTimestampFormatter.INSTANCE);
    }

    public DetectorFactory(SeasonalHybridEsd engine, TimestampFormatter formatter) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
    }

    /**
     * @param config the detector profile; must not be {@code null}
     * @return the detector for the profile's type
     * @throws NullPointerException           if {@code config} or its type is
     *                                        {@code null}
     * @throws IllegalArgumentException       if the type is unknown
     * @throws InvalidConfigurationException  if the profile breaks a rule of
     *                                        its type
     */
    public AnomalyDetector create(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        DetectorType type = DetectorType.parse(config.getType());
        try {
            config.validate();
        } catch (IllegalStateException e) {
            throw new InvalidConfigurationException(e.getMessage());
        }

        AnomalyDetector detector = switch (type) {
            case VECTOR -> new VectorAnomalyDetector(config, engine, formatter);
            case TIMESERIES -> new TimeSeriesAnomalyDetector(config, engine, formatter);
        };
        LOG.debug("Created {} detector '{}': maxAnoms={}, direction={}, alpha={}, period={}",
                type.label(), config.getName(), config.getMaxAnoms(), config.getDirection(),
                config.getAlpha(), type == DetectorType.VECTOR ? config.getPeriod() : "granularity");
        return detector;
    }

    /**
     * Create one detector per profile, in order.
     *
     * @param configs detector profiles; must not be {@code null}
     * @return unmodifiable list of detectors
     * @throws NullPointerException     if {@code configs} is {@code null}
     * @throws IllegalArgumentException if two profiles share a name or a
     *                                  profile is invalid
     */
    public List<AnomalyDetector> createAll(List<DetectorConfig> configs) {
        Objects.requireNonNull(configs, "Detector configuration list must not be null");
        Set<String> names = new HashSet<>();
        Map<DetectorType, Integer> perType = new EnumMap<>(DetectorType.class);
        List<AnomalyDetector> detectors = new ArrayList<>(configs.size());

        for (DetectorConfig config : configs) {
            AnomalyDetector detector = create(config);
            if (!names.add(detector.getName())) {
                throw new InvalidConfigurationException(
                        "Duplicate detector name: '" + detector.getName() + "'");
            }
            perType.merge(DetectorType.parse(config.getType()), 1, Integer::sum);
            detectors.add(detector);
        }

        LOG.info("Created {} detector(s) {}", detectors.size(), perType);
        return List.copyOf(detectors);
    }
}
