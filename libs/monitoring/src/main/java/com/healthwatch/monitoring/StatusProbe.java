package com.healthwatch.monitoring;

import com.healthwatch.statusmodel.HealthStatus;

/**
 * Liveness check for a single named dependency.
 * <p>
 * Implementations never propagate environment failures (timeouts, missing tools, process
 * errors): those are reported as a {@link HealthStatus#DOWN} outcome with a reason. Only a
 * structurally invalid name is surfaced, as an {@link IllegalArgumentException}.
 * <p>
 * Example usage:
 * <pre>{@code
 * StatusProbe probe = new ProcessStatusProbe();
 * ProbeOutcome outcome = probe.probe("httpd");
 * if (!outcome.isUp()) {
 *     log.warn("httpd is down: {}", outcome.detail());
 * }
 * }</pre>
 */
public interface StatusProbe {

    /**
     * Checks one dependency.
     *
     * @param name dependency name (e.g., "httpd")
     * @return the outcome; never null
     * @throws IllegalArgumentException if the name is null or blank
     */
    ProbeOutcome probe(String name);

    /**
     * Checks one dependency and returns only its status.
     */
    default HealthStatus checkStatus(String name) {
        return probe(name).status();
    }

    /**
     * Returns the name of the host this probe runs on.
     */
    String currentHost();

    /**
     * Returns the current time as an ISO-8601 UTC string with a {@code Z} suffix.
     */
    String now();
}
