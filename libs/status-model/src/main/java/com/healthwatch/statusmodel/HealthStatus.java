package com.healthwatch.statusmodel;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Liveness of a single dependency or of the monitored application as a whole.
 * <p>
 * There is no "unknown" state: a check that cannot be completed is reported as {@link #DOWN}.
 */
public enum HealthStatus {

    /** The service is active. */
    UP,

    /** The service is inactive, failed, or could not be checked. */
    DOWN;

    /**
     * Returns the wire names of all permitted values, in declaration order.
     */
    public static List<String> permittedValues() {
        return Arrays.stream(values()).map(Enum::name).toList();
    }

    /**
     * Parses an exact wire value ({@code "UP"} or {@code "DOWN"}). Matching is case-sensitive.
     *
     * @param value the wire value, may be null
     * @return the status, or empty if the value is not permitted
     */
    public static Optional<HealthStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (HealthStatus status : values()) {
            if (status.name().equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    /** Returns true for {@link #UP}. */
    public boolean isUp() {
        return this == UP;
    }
}
