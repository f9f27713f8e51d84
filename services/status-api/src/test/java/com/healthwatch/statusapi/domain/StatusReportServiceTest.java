package com.healthwatch.statusapi.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.healthwatch.observability.MetricFactory;
import com.healthwatch.statusapi.infrastructure.store.InMemoryReportStore;
import com.healthwatch.statusmodel.HealthStatus;
import com.healthwatch.statusmodel.StatusRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StatusReportService")
class StatusReportServiceTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final StatusReportService service =
            new StatusReportService(new InMemoryReportStore(), new MetricFactory(registry, "status-api"));

    @Test
    @DisplayName("ingest stores the record and counts it by status")
    void ingestCounts() {
        service.ingest(new StatusRecord("httpd", HealthStatus.UP, "web-01", "2024-01-15T10:30:00Z"));
        service.ingest(new StatusRecord("rabbitmq", HealthStatus.DOWN, "mq-01", "2024-01-15T10:30:00Z"));

        assertThat(service.allStatuses()).containsExactly(
                Map.entry("httpd", HealthStatus.UP),
                Map.entry("rabbitmq", HealthStatus.DOWN));
        assertThat(registry.find("healthwatch.api.ingested").tag("status", "UP").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("latest() of an unknown service throws StatusNotFoundException")
    void unknownService() {
        assertThatThrownBy(() -> service.latest("nginx"))
                .isInstanceOf(StatusNotFoundException.class)
                .hasMessage("Service \"nginx\" not found");
    }
}
