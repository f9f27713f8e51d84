package com.healthwatch.statusmonitor;

import com.healthwatch.statusmonitor.config.MonitorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Healthwatch status monitor: one monitoring pass per invocation.
 *
 * <p>Probes the configured dependencies (or the services passed with {@code
 * --healthwatch.monitor.services=...}), writes a JSON snapshot per result, prints a summary and
 * exits with 0 only when everything checked is UP. Typically run from cron or a systemd timer.
 *
 * <p>The process exit code comes from {@link com.healthwatch.statusmonitor.runner.MonitorRunner},
 * collected through {@link SpringApplication#exit}.
 */
@SpringBootApplication
@EnableConfigurationProperties(MonitorProperties.class)
public class StatusMonitorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(StatusMonitorApplication.class, args)));
    }
}
