package com.healthwatch.statusmonitor.runner;

import com.healthwatch.monitoring.MonitoringReport;
import com.healthwatch.statusmodel.HealthStatus;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one monitoring pass, as printed to the console and turned into an exit code.
 *
 * @param timestamp shared timestamp of the pass
 * @param hostName host the pass ran on
 * @param statuses per-service status, in probe order
 * @param applicationName monitored application; null in service mode
 * @param applicationStatus application verdict; null in service mode
 * @param writtenFiles snapshot files written during the pass
 * @param error failure description of a degraded pass, null otherwise
 */
public record MonitoringSummary(
        String timestamp,
        String hostName,
        Map<String, HealthStatus> statuses,
        String applicationName,
        HealthStatus applicationStatus,
        List<Path> writtenFiles,
        String error) {

    public MonitoringSummary {
        statuses = Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
        writtenFiles = List.copyOf(writtenFiles);
    }

    static MonitoringSummary forApplication(MonitoringReport report, String hostName, List<Path> writtenFiles) {
        return new MonitoringSummary(
                report.timestamp(),
                hostName,
                report.statuses(),
                report.applicationRecord().name(),
                report.verdict(),
                writtenFiles,
                report.error());
    }

    static MonitoringSummary forServices(
            Map<String, HealthStatus> statuses, String timestamp, String hostName, List<Path> writtenFiles) {
        return new MonitoringSummary(timestamp, hostName, statuses, null, null, writtenFiles, null);
    }

    /**
     * Process exit code: in application mode 0 iff the verdict is UP, in service mode 0 iff every
     * requested service is UP.
     */
    public int exitCode() {
        if (applicationStatus != null) {
            return applicationStatus.isUp() ? 0 : 1;
        }
        return statuses.values().stream().allMatch(HealthStatus::isUp) ? 0 : 1;
    }
}
