package com.healthwatch.statusapi.api;

import com.healthwatch.statusapi.api.dto.HealthcheckResponse;
import com.healthwatch.statusapi.api.dto.IngestResponse;
import com.healthwatch.statusapi.api.dto.ServiceStatusResponse;
import com.healthwatch.statusapi.domain.StatusReportService;
import com.healthwatch.statusmodel.StatusRecord;
import com.healthwatch.statusmodel.Timestamps;
import java.time.Clock;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Status ingest and query endpoints.
 *
 * <p>Errors are raised as exceptions and rendered by {@link
 * com.healthwatch.statusapi.infrastructure.web.GlobalExceptionHandler}.
 */
@RestController
public class StatusController {

    private final StatusReportService service;
    private final Clock clock;

    public StatusController(StatusReportService service, Clock clock) {
        this.service = service;
        this.clock = clock;
    }

    @PostMapping(path = "/add", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<IngestResponse> add(@RequestBody(required = false) Map<String, Object> body) {
        StatusRecord record = StatusRecordRequests.toRecord(body, this::now);
        service.ingest(record);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new IngestResponse(IngestResponse.STORED, record.name(), now()));
    }

    @GetMapping("/healthcheck")
    public HealthcheckResponse healthcheck() {
        return new HealthcheckResponse(service.allStatuses(), now());
    }

    @GetMapping("/healthcheck/{serviceName}")
    public ServiceStatusResponse healthcheckService(@PathVariable String serviceName) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("Service name cannot be empty");
        }
        StatusRecord record = service.latest(serviceName.strip());
        return ServiceStatusResponse.of(record, now());
    }

    private String now() {
        return Timestamps.now(clock);
    }
}
