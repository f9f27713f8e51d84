package com.healthwatch.statusmonitor.config;

import com.healthwatch.monitoring.MonitoredApplication;
import com.healthwatch.monitoring.ProcessStatusProbe;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for a monitoring pass, bound from {@code healthwatch.monitor.*}.
 *
 * <pre>
 * healthwatch:
 *   monitor:
 *     services: [httpd, rabbitmq]   # empty = the application and all its dependencies
 *     output-dir: data
 *     write-files: true
 *     quiet: false
 *     application:
 *       name: rbcapp1
 *       dependencies: [httpd, rabbitmq, postgresql]
 *     probe:
 *       command: systemctl
 *       timeout: 10s
 * </pre>
 *
 * @param services names to check in service mode; empty selects application mode
 * @param outputDir directory for snapshot files
 * @param writeFiles whether snapshots are written at all
 * @param quiet suppress the console summary and error line
 * @param application monitored application and its dependency set
 * @param probe supervisor command settings
 */
@ConfigurationProperties(prefix = "healthwatch.monitor")
@Validated
public record MonitorProperties(
        List<String> services,
        @NotBlank String outputDir,
        Boolean writeFiles,
        boolean quiet,
        @Valid Application application,
        @Valid Probe probe) {

    public MonitorProperties {
        services = services == null ? List.of() : List.copyOf(services);
        if (outputDir == null || outputDir.isBlank()) {
            outputDir = "data";
        }
        if (writeFiles == null) {
            writeFiles = Boolean.TRUE;
        }
        if (application == null) {
            application = new Application(null, null);
        }
        if (probe == null) {
            probe = new Probe(null, null);
        }
    }

    /** Returns true when specific services were requested instead of the whole application. */
    public boolean serviceMode() {
        return !services.isEmpty();
    }

    /**
     * @param name application name written to the application-level snapshot
     * @param dependencies dependencies that must all be UP for the application to be UP
     */
    public record Application(@NotBlank String name, @NotEmpty List<String> dependencies) {

        public Application {
            if (name == null || name.isBlank()) {
                name = MonitoredApplication.DEFAULT_NAME;
            }
            if (dependencies == null || dependencies.isEmpty()) {
                dependencies = MonitoredApplication.DEFAULT_DEPENDENCIES;
            }
        }

        public MonitoredApplication toMonitoredApplication() {
            return new MonitoredApplication(name, dependencies);
        }
    }

    /**
     * @param command supervisor binary
     * @param timeout bound on a single supervisor call
     */
    public record Probe(@NotBlank String command, Duration timeout) {

        public Probe {
            if (command == null || command.isBlank()) {
                command = ProcessStatusProbe.DEFAULT_COMMAND;
            }
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                timeout = ProcessStatusProbe.DEFAULT_TIMEOUT;
            }
        }
    }
}
