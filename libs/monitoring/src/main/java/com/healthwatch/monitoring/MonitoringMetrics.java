package com.healthwatch.monitoring;

import com.healthwatch.observability.MetricFactory;
import com.healthwatch.statusmodel.HealthStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Micrometer instrumentation for probes, verdicts and snapshot writes.
 * <p>
 * Meters:
 * <ul>
 *   <li>{@code healthwatch.probe.results} counter, tagged {@code service} and {@code status}
 *   <li>{@code healthwatch.probe.duration} timer, tagged {@code service}
 *   <li>{@code healthwatch.verdict} gauge (1 = UP, 0 = DOWN), tagged {@code application}
 *   <li>{@code healthwatch.snapshot.writes} counter, tagged {@code result} (written/failed)
 * </ul>
 */
public final class MonitoringMetrics {

    private final MetricFactory metrics;

    public MonitoringMetrics(MetricFactory metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.metrics = metrics;
    }

    /**
     * Returns metrics backed by a private in-memory registry, for callers that export none.
     */
    public static MonitoringMetrics standalone() {
        return new MonitoringMetrics(new MetricFactory(new SimpleMeterRegistry(), "healthwatch"));
    }

    void recordProbe(ProbeOutcome outcome) {
        String service = String.valueOf(outcome.name());
        metrics.counter("healthwatch.probe.results", "Dependency probe results",
                        "service", service, "status", outcome.status().name())
                .increment();
        metrics.timer("healthwatch.probe.duration", "Dependency probe duration", "service", service)
                .record(Duration.ofMillis(outcome.latencyMs()));
    }

    void recordVerdict(String application, HealthStatus verdict) {
        metrics.gauge("healthwatch.verdict", "Application verdict (1 = UP)", "application", application)
                .set(verdict.isUp() ? 1 : 0);
    }

    void recordSnapshot(WriteOutcome outcome) {
        metrics.counter("healthwatch.snapshot.writes", "Snapshot file writes",
                        "result", outcome.succeeded() ? "written" : "failed")
                .increment();
    }

    /** Returns the factory the meters are registered through. */
    public MetricFactory factory() {
        return metrics;
    }
}
