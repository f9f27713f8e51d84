package com.healthwatch.statusapi.infrastructure.store;

import com.healthwatch.statusapi.domain.ReportStore;
import com.healthwatch.statusapi.domain.ReportStoreUnavailableException;
import com.healthwatch.statusmodel.HealthStatus;
import com.healthwatch.statusmodel.StatusRecord;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ReportStore} used when storage is switched off: every call fails as unavailable.
 */
public class UnavailableReportStore implements ReportStore {

    static final String MESSAGE = "Report store is not available";

    @Override
    public void save(StatusRecord record) {
        throw new ReportStoreUnavailableException(MESSAGE);
    }

    @Override
    public Map<String, HealthStatus> latestStatuses() {
        throw new ReportStoreUnavailableException(MESSAGE);
    }

    @Override
    public Optional<StatusRecord> latest(String serviceName) {
        throw new ReportStoreUnavailableException(MESSAGE);
    }
}
