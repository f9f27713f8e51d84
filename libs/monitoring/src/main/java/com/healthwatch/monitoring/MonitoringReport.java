package com.healthwatch.monitoring;

import com.healthwatch.statusmodel.HealthStatus;
import com.healthwatch.statusmodel.StatusRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one aggregation pass.
 *
 * @param statuses          per-dependency status, in probe order
 * @param verdict           application verdict (UP only if every configured dependency is UP)
 * @param dependencyRecords one record per probed dependency
 * @param applicationRecord record for the application itself
 * @param timestamp         timestamp shared by every record in this report
 * @param error             description of the failure for a degraded report, null otherwise
 */
public record MonitoringReport(
        Map<String, HealthStatus> statuses,
        HealthStatus verdict,
        List<StatusRecord> dependencyRecords,
        StatusRecord applicationRecord,
        String timestamp,
        String error
) {

    public MonitoringReport {
        statuses = Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
        dependencyRecords = List.copyOf(dependencyRecords);
    }

    /**
     * Builds the report returned when assembly failed: no dependency data, verdict DOWN.
     */
    public static MonitoringReport degraded(StatusRecord applicationRecord, String error) {
        return new MonitoringReport(Map.of(), HealthStatus.DOWN, List.of(), applicationRecord,
                applicationRecord.timestamp(), error);
    }

    /** Returns true if this report was produced after an assembly failure. */
    public boolean isDegraded() {
        return error != null;
    }

    /** Returns the dependency records followed by the application record. */
    public List<StatusRecord> allRecords() {
        List<StatusRecord> all = new ArrayList<>(dependencyRecords);
        all.add(applicationRecord);
        return all;
    }
}
