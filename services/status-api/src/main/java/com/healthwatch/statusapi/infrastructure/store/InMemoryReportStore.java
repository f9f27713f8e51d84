package com.healthwatch.statusapi.infrastructure.store;

import com.healthwatch.statusapi.domain.ReportStore;
import com.healthwatch.statusmodel.HealthStatus;
import com.healthwatch.statusmodel.StatusRecord;
import com.healthwatch.statusmodel.Timestamps;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ReportStore} that keeps only the latest record per service in memory.
 *
 * <p>Replacement is an atomic per-key merge: the incoming record wins unless its timestamp is
 * strictly older than the stored one.
 */
public class InMemoryReportStore implements ReportStore {

    private final ConcurrentHashMap<String, Entry> latest = new ConcurrentHashMap<>();

    @Override
    public void save(StatusRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        latest.merge(record.name(), new Entry(record, instantOf(record)), InMemoryReportStore::newer);
    }

    @Override
    public Map<String, HealthStatus> latestStatuses() {
        Map<String, HealthStatus> statuses = new HashMap<>();
        latest.forEach((name, entry) -> statuses.put(name, entry.record().status()));
        return statuses;
    }

    @Override
    public Optional<StatusRecord> latest(String serviceName) {
        if (serviceName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(latest.get(serviceName)).map(Entry::record);
    }

    /** Returns the number of services with a stored record. */
    public int size() {
        return latest.size();
    }

    private static Entry newer(Entry stored, Entry incoming) {
        return incoming.instant().isBefore(stored.instant()) ? stored : incoming;
    }

    private static Instant instantOf(StatusRecord record) {
        // records are validated on construction, so the timestamp always parses
        return Timestamps.parse(record.timestamp()).orElse(Instant.MIN);
    }

    private record Entry(StatusRecord record, Instant instant) {}
}
