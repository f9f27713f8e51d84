package com.healthwatch.statusmonitor.config;

import com.healthwatch.monitoring.CommandRunner;
import com.healthwatch.monitoring.HealthAggregator;
import com.healthwatch.monitoring.MonitoredApplication;
import com.healthwatch.monitoring.MonitoringMetrics;
import com.healthwatch.monitoring.ProcessCommandRunner;
import com.healthwatch.monitoring.ProcessStatusProbe;
import com.healthwatch.monitoring.SnapshotWriter;
import com.healthwatch.monitoring.StatusProbe;
import com.healthwatch.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the monitoring library from {@link MonitorProperties}.
 */
@Configuration
public class MonitoringConfig {

    static final String COMPONENT = "status-monitor";

    @Bean
    public MonitoringMetrics monitoringMetrics(MeterRegistry meterRegistry) {
        return new MonitoringMetrics(new MetricFactory(meterRegistry, COMPONENT));
    }

    @Bean
    public CommandRunner commandRunner() {
        return new ProcessCommandRunner();
    }

    @Bean
    public StatusProbe statusProbe(CommandRunner commandRunner, MonitorProperties properties) {
        return new ProcessStatusProbe(
                commandRunner, properties.probe().command(), properties.probe().timeout());
    }

    @Bean
    public MonitoredApplication monitoredApplication(MonitorProperties properties) {
        return properties.application().toMonitoredApplication();
    }

    @Bean
    public HealthAggregator healthAggregator(
            StatusProbe statusProbe, MonitoredApplication application, MonitoringMetrics metrics) {
        return new HealthAggregator(statusProbe, application, metrics);
    }

    @Bean
    public SnapshotWriter snapshotWriter(MonitoringMetrics metrics) {
        return new SnapshotWriter(metrics);
    }
}
