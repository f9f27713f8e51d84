package com.healthwatch.monitoring;

import com.healthwatch.statusmodel.HealthStatus;
import com.healthwatch.statusmodel.StatusRecord;
import com.healthwatch.statusmodel.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Probes the dependencies of a {@link MonitoredApplication} and reduces the results to a
 * per-dependency status map and a single application verdict.
 * <p>
 * Dependencies are probed one after another on the calling thread. A probe that throws is
 * recorded as DOWN for that dependency only; the rest of the batch still runs. Each call is
 * self-contained: no state is carried from one pass to the next.
 */
public final class HealthAggregator {

    private static final Logger log = LoggerFactory.getLogger(HealthAggregator.class);

    private final StatusProbe probe;
    private final MonitoredApplication application;
    private final MonitoringMetrics metrics;

    /**
     * Creates an aggregator with standalone metrics.
     */
    public HealthAggregator(StatusProbe probe, MonitoredApplication application) {
        this(probe, application, MonitoringMetrics.standalone());
    }

    /**
     * Creates an aggregator.
     *
     * @param probe       liveness check run once per dependency
     * @param application application name and required dependency set
     * @param metrics     probe and verdict instrumentation
     */
    public HealthAggregator(StatusProbe probe, MonitoredApplication application, MonitoringMetrics metrics) {
        if (probe == null) {
            throw new IllegalArgumentException("probe must not be null");
        }
        if (application == null) {
            throw new IllegalArgumentException("application must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.probe = probe;
        this.application = application;
        this.metrics = metrics;
    }

    /**
     * Checks every configured dependency.
     */
    public Map<String, HealthStatus> checkAll() {
        return checkAll(application.dependencies());
    }

    /**
     * Checks the given names.
     *
     * @return name to status, in input order
     * @throws IllegalArgumentException if the list is null or empty
     */
    public Map<String, HealthStatus> checkAll(List<String> names) {
        Map<String, HealthStatus> statuses = new LinkedHashMap<>();
        probeAll(names).forEach((name, outcome) -> statuses.put(name, outcome.status()));
        return statuses;
    }

    /**
     * Probes the given names and keeps the full outcome of each.
     *
     * @return name to outcome, in input order
     * @throws IllegalArgumentException if the list is null or empty
     */
    public Map<String, ProbeOutcome> probeAll(List<String> names) {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("services list cannot be empty");
        }

        Map<String, ProbeOutcome> outcomes = new LinkedHashMap<>();
        for (String name : names) {
            ProbeOutcome outcome;
            try {
                outcome = probe.probe(name);
                log.info("Service {}: {}", name, outcome.status());
            } catch (RuntimeException e) {
                log.error("Error checking service {}: {}", name, e.getMessage());
                outcome = ProbeOutcome.failed(name, e);
            }
            metrics.recordProbe(outcome);
            outcomes.put(name, outcome);
        }
        return outcomes;
    }

    /**
     * Derives the application verdict.
     * <p>
     * UP only if every configured dependency is present with UP. A missing dependency counts as
     * DOWN; names outside the configured set are ignored.
     */
    public HealthStatus deriveVerdict(Map<String, HealthStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            log.warn("No service statuses provided, considering {} DOWN", application.name());
            return HealthStatus.DOWN;
        }

        for (String dependency : application.dependencies()) {
            HealthStatus status = statuses.get(dependency);
            if (status == null) {
                log.warn("Required service {} not found in status check", dependency);
                return HealthStatus.DOWN;
            }
            if (status != HealthStatus.UP) {
                log.warn("Required service {} is {}, {} is DOWN", dependency, status, application.name());
                return HealthStatus.DOWN;
            }
        }

        log.info("All required services are UP, {} is UP", application.name());
        return HealthStatus.UP;
    }

    /**
     * Wraps each entry as a {@link StatusRecord} sharing this probe's host and the given timestamp.
     * Entries that cannot form a valid record are logged and skipped.
     */
    public List<StatusRecord> recordsFor(Map<String, HealthStatus> statuses, String timestamp) {
        String host = probe.currentHost();
        List<StatusRecord> records = new ArrayList<>(statuses.size());
        statuses.forEach((name, status) -> {
            try {
                records.add(new StatusRecord(name, status, host, timestamp));
            } catch (IllegalArgumentException e) {
                log.error("Error creating status record for {}: {}", name, e.getMessage());
            }
        });
        return records;
    }

    /**
     * Creates the application-level record.
     */
    public StatusRecord applicationRecord(HealthStatus verdict, String timestamp) {
        return new StatusRecord(application.name(), verdict, probe.currentHost(), timestamp);
    }

    /**
     * Runs a full pass over the configured dependencies.
     * <p>
     * Never throws: if assembly fails, returns a degraded report with no dependency data, a DOWN
     * verdict, a DOWN application record and the failure in {@link MonitoringReport#error()}.
     */
    public MonitoringReport buildReport() {
        try {
            Map<String, HealthStatus> statuses = checkAll();
            HealthStatus verdict = deriveVerdict(statuses);
            String timestamp = probe.now();

            MonitoringReport report = new MonitoringReport(
                    statuses,
                    verdict,
                    recordsFor(statuses, timestamp),
                    applicationRecord(verdict, timestamp),
                    timestamp,
                    null);
            metrics.recordVerdict(application.name(), verdict);
            return report;
        } catch (RuntimeException e) {
            log.error("Error generating monitoring report: {}", e.toString());
            metrics.recordVerdict(application.name(), HealthStatus.DOWN);
            return MonitoringReport.degraded(fallbackApplicationRecord(), describe(e));
        }
    }

    /** Returns the monitored application. */
    public MonitoredApplication application() {
        return application;
    }

    private StatusRecord fallbackApplicationRecord() {
        try {
            return new StatusRecord(application.name(), HealthStatus.DOWN, probe.currentHost(), probe.now());
        } catch (RuntimeException e) {
            log.warn("Probe unusable for degraded report, using local fallbacks: {}", e.getMessage());
            return new StatusRecord(application.name(), HealthStatus.DOWN,
                    ProcessStatusProbe.UNKNOWN_HOST, Timestamps.now());
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
