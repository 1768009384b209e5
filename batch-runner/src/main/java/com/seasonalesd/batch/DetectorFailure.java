package com.seasonalesd.batch;

import java.util.Objects;

/**
 * A detector that could not produce a report, with the reason.
 */
public final class DetectorFailure {

    private final String detectorName;
    private final String message;

    public DetectorFailure(String detectorName, String message) {
        this.detectorName = Objects.requireNonNull(detectorName, "detectorName must not be null");
        this.message = message;
    }

    public String getDetectorName() {
        return detectorName;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorFailure that))
            return false;
        return detectorName.equals(that.detectorName) && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detectorName, message);
    }

    @Override
    public String toString() {
        return "DetectorFailure{detectorName='" + detectorName + "', message='" + message + "'}";
    }
}
