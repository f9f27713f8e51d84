package com.healthwatch.statusmonitor.runner;

import com.healthwatch.monitoring.HealthAggregator;
import com.healthwatch.monitoring.MonitoringReport;
import com.healthwatch.monitoring.SnapshotWriter;
import com.healthwatch.monitoring.StatusProbe;
import com.healthwatch.observability.CorrelationContext;
import com.healthwatch.observability.CorrelationContextHolder;
import com.healthwatch.statusmodel.HealthStatus;
import com.healthwatch.statusmodel.StatusRecord;
import com.healthwatch.statusmonitor.config.MonitorProperties;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs a single monitoring pass at startup and keeps its exit code for {@link
 * org.springframework.boot.SpringApplication#exit}.
 *
 * <p>Application mode (no services configured) builds the full report, writes one snapshot per
 * dependency plus one for the application, and exits 0 iff the verdict is UP. Service mode checks
 * only the requested names and exits 0 iff all of them are UP. Any failure exits 1.
 *
 * <p>The pass runs under its own correlation ID so every log line of one run can be grouped.
 * Disabled with {@code healthwatch.monitor.run-on-startup=false}.
 */
@Component
@ConditionalOnProperty(
        prefix = "healthwatch.monitor",
        name = "run-on-startup",
        havingValue = "true",
        matchIfMissing = true)
public class MonitorRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(MonitorRunner.class);

    static final String COMPONENT = "status-monitor";

    private final HealthAggregator aggregator;
    private final StatusProbe probe;
    private final SnapshotWriter writer;
    private final MonitorProperties properties;
    private final MonitoringSummaryPrinter printer;

    private volatile int exitCode;

    public MonitorRunner(
            HealthAggregator aggregator,
            StatusProbe probe,
            SnapshotWriter writer,
            MonitorProperties properties,
            MonitoringSummaryPrinter printer) {
        this.aggregator = aggregator;
        this.probe = probe;
        this.writer = writer;
        this.properties = properties;
        this.printer = printer;
    }

    @Override
    public void run(ApplicationArguments args) {
        var context = new CorrelationContext(UUID.randomUUID().toString(), COMPONENT, probe.currentHost());
        exitCode = CorrelationContextHolder.callWithContext(context, this::monitorOnce);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int monitorOnce() {
        try {
            MonitoringSummary summary = properties.serviceMode()
                    ? monitorServices(properties.services())
                    : monitorApplication();

            if (!properties.quiet()) {
                printer.print(summary);
            }

            int code = summary.exitCode();
            if (code != 0) {
                log.warn("Monitoring detected issues - exiting with error code");
            }
            return code;
        } catch (RuntimeException e) {
            log.error("Monitoring failed: {}", e.getMessage(), e);
            if (!properties.quiet()) {
                printer.printError(e.getMessage());
            }
            return 1;
        }
    }

    private MonitoringSummary monitorApplication() {
        log.info("Monitoring {} application", aggregator.application().name());
        MonitoringReport report = aggregator.buildReport();

        List<Path> written = new ArrayList<>();
        if (properties.writeFiles()) {
            Path directory = Path.of(properties.outputDir());
            log.info("Writing status files to {}", directory);
            written.addAll(writer.writeAll(report.dependencyRecords(), directory));
            written.add(writer.write(report.applicationRecord(), directory));
            log.info("Successfully wrote {} status files", written.size());
        }

        log.info("{} status: {}", report.applicationRecord().name(), report.verdict());
        return MonitoringSummary.forApplication(report, probe.currentHost(), written);
    }

    private MonitoringSummary monitorServices(List<String> services) {
        log.info("Monitoring specific services: {}", services);
        Map<String, HealthStatus> statuses = aggregator.checkAll(services);
        String timestamp = probe.now();
        List<StatusRecord> records = aggregator.recordsFor(statuses, timestamp);

        List<Path> written = List.of();
        if (properties.writeFiles() && !records.isEmpty()) {
            Path directory = Path.of(properties.outputDir());
            log.info("Writing status files to {}", directory);
            written = writer.writeAll(records, directory);
            log.info("Successfully wrote {} status files", written.size());
        }

        return MonitoringSummary.forServices(statuses, timestamp, probe.currentHost(), written);
    }
}
