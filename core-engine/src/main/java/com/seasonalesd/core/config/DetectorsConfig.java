package com.seasonalesd.core.config;

import com.seasonalesd.core.model.DetectorConfig;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The detector profiles of one run, as read by {@link DetectorsLoader}.
 *
 * <p>
 * YAML structure, with the optional shared {@code defaults} already merged
 * into each profile by the time this object exists:
 * </p>
 *
 * <pre>
 * defaults:
 *   alpha: 0.05
 * detectors:
 *   - name: hourly_traffic
 *     type: timeseries
 *     maxAnoms: 0.02
 *     direction: both
 *     onlyLast: day
 *   - name: sensor_vector
 *     type: vector
 *     period: 24
 *     longtermPeriod: 168
 * </pre>
 *
 * @since 1.0.0
 */
public class DetectorsConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<DetectorConfig> detectors = new ArrayList<>();

    /**
     * Return the detectors list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of detector configurations
     */
    public List<DetectorConfig> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    /**
     * Replace the detectors list.
     *
     * @param detectors the detector configurations
     */
    public void setDetectors(List<DetectorConfig> detectors) {
        this.detectors = detectors != null ? new ArrayList<>(detectors) : new ArrayList<>();
    }

    /**
     * Validate every detector in this configuration.
     *
     * <p>
     * Delegates to {@link DetectorConfig#validate()} for each entry and also
     * rejects duplicate names. Collects all errors and throws a single
     * exception if anything is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more detectors are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < detectors.size(); i++) {
            DetectorConfig detector = Objects.requireNonNull(detectors.get(i),
                    "Detector at index " + i + " is null");
            try {
                detector.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (detector.getName() != null && !names.add(detector.getName())) {
                errors.add("Duplicate detector name: '" + detector.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detectors configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "DetectorsConfig{detectors=" + detectors + '}';
    }
}
