package com.healthwatch.monitoring;

import com.healthwatch.statusmodel.HealthStatus;

/**
 * Result of probing a single dependency.
 *
 * @param name      dependency name (e.g., "httpd", "postgresql")
 * @param status    UP or DOWN
 * @param detail    supervisor output or the reason the probe degraded to DOWN
 * @param latencyMs time taken to check this dependency (in milliseconds)
 */
public record ProbeOutcome(String name, HealthStatus status, String detail, long latencyMs) {

    /** Creates an UP outcome. */
    public static ProbeOutcome up(String name, String detail, long latencyMs) {
        return new ProbeOutcome(name, HealthStatus.UP, detail, latencyMs);
    }

    /** Creates a DOWN outcome with a reason. */
    public static ProbeOutcome down(String name, String reason, long latencyMs) {
        return new ProbeOutcome(name, HealthStatus.DOWN, reason, latencyMs);
    }

    /** Creates a DOWN outcome for a probe that threw instead of answering. */
    public static ProbeOutcome failed(String name, Throwable cause) {
        return new ProbeOutcome(name, HealthStatus.DOWN, "Probe failed: " + cause.getMessage(), 0);
    }

    /** Returns true if the dependency is UP. */
    public boolean isUp() {
        return status == HealthStatus.UP;
    }
}
