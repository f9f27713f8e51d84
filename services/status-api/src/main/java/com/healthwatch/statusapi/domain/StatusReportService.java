package com.healthwatch.statusapi.domain;

import com.healthwatch.observability.MetricFactory;
import com.healthwatch.statusmodel.HealthStatus;
import com.healthwatch.statusmodel.StatusRecord;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ingests status records and answers latest-status queries over a {@link ReportStore}.
 */
@Service
public class StatusReportService {

    private static final Logger log = LoggerFactory.getLogger(StatusReportService.class);

    private final ReportStore store;
    private final MetricFactory metrics;

    public StatusReportService(ReportStore store, MetricFactory metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * Stores a validated record.
     *
     * @throws ReportStoreUnavailableException if the store cannot be reached
     */
    public void ingest(StatusRecord record) {
        store.save(record);
        metrics.counter("healthwatch.api.ingested", "Status records ingested",
                        "status", record.status().name())
                .increment();
        log.info("Stored status for {}: {} (host {}, {})",
                record.name(), record.status(), record.host(), record.timestamp());
    }

    /**
     * Returns the latest status per service, sorted by service name.
     */
    public Map<String, HealthStatus> allStatuses() {
        Map<String, HealthStatus> statuses = new TreeMap<>(store.latestStatuses());
        log.debug("Returning status for {} services", statuses.size());
        return statuses;
    }

    /**
     * Returns the latest record for a service.
     *
     * @throws StatusNotFoundException if nothing was stored for the name
     */
    public StatusRecord latest(String serviceName) {
        return store.latest(serviceName).orElseThrow(() -> new StatusNotFoundException(serviceName));
    }
}
