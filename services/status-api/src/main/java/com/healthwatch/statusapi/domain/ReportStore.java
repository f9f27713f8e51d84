package com.healthwatch.statusapi.domain;

import com.healthwatch.statusmodel.HealthStatus;
import com.healthwatch.statusmodel.StatusRecord;
import java.util.Map;
import java.util.Optional;

/**
 * Port for the storage behind the status API.
 *
 * <p>"Latest" is the record with the greatest parsed timestamp for a service name; a timestamp
 * without an offset counts as UTC. When two records carry the same instant, the one stored last
 * wins. Implementations must be safe for concurrent use.
 *
 * <p>Every operation may throw {@link ReportStoreUnavailableException} when the backing store
 * cannot be reached.
 */
public interface ReportStore {

    /** Stores a record. */
    void save(StatusRecord record);

    /** Returns the latest status of every known service, keyed by service name. */
    Map<String, HealthStatus> latestStatuses();

    /** Returns the latest record for a service, if any was stored. */
    Optional<StatusRecord> latest(String serviceName);
}
