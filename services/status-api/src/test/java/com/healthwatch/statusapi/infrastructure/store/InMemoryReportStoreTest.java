package com.healthwatch.statusapi.infrastructure.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.healthwatch.statusmodel.HealthStatus;
import com.healthwatch.statusmodel.StatusRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryReportStore")
class InMemoryReportStoreTest {

    private final InMemoryReportStore store = new InMemoryReportStore();

    private static StatusRecord record(String name, HealthStatus status, String timestamp) {
        return new StatusRecord(name, status, "web-01", timestamp);
    }

    @Nested
    @DisplayName("latest")
    class Latest {

        @Test
        @DisplayName("keeps the record with the greatest timestamp")
        void greatestTimestampWins() {
            store.save(record("httpd", HealthStatus.DOWN, "2024-01-15T10:30:00Z"));
            store.save(record("httpd", HealthStatus.UP, "2024-01-15T10:00:00Z"));

            assertThat(store.latest("httpd")).get()
                    .extracting(StatusRecord::status).isEqualTo(HealthStatus.DOWN);
        }

        @Test
        @DisplayName("compares instants, not strings")
        void comparesInstants() {
            store.save(record("httpd", HealthStatus.UP, "2024-01-15T10:30:00+02:00"));
            store.save(record("httpd", HealthStatus.DOWN, "2024-01-15T09:00:00Z"));

            assertThat(store.latest("httpd")).get()
                    .extracting(StatusRecord::status).isEqualTo(HealthStatus.DOWN);
        }

        @Test
        @DisplayName("timestamp without offset counts as UTC")
        void localTimeIsUtc() {
            store.save(record("httpd", HealthStatus.UP, "2024-01-15T10:30:00.5Z"));
            store.save(record("httpd", HealthStatus.DOWN, "2024-01-15T10:30:01"));

            assertThat(store.latest("httpd")).get()
                    .extracting(StatusRecord::status).isEqualTo(HealthStatus.DOWN);
        }

        @Test
        @DisplayName("equal instants go to the record stored last")
        void tieGoesToLastStored() {
            store.save(record("httpd", HealthStatus.UP, "2024-01-15T10:30:00Z"));
            store.save(record("httpd", HealthStatus.DOWN, "2024-01-15T10:30:00.000Z"));

            assertThat(store.latest("httpd")).get()
                    .extracting(StatusRecord::status).isEqualTo(HealthStatus.DOWN);
        }

        @Test
        @DisplayName("unknown or null name is empty")
        void unknownName() {
            assertThat(store.latest("nginx")).isEmpty();
            assertThat(store.latest(null)).isEmpty();
        }
    }

    @Test
    @DisplayName("latestStatuses() holds one entry per service")
    void latestStatuses() {
        store.save(record("httpd", HealthStatus.UP, "2024-01-15T10:30:00Z"));
        store.save(record("rabbitmq", HealthStatus.DOWN, "2024-01-15T10:30:00Z"));
        store.save(record("rabbitmq", HealthStatus.UP, "2024-01-15T10:31:00Z"));

        assertThat(store.latestStatuses())
                .hasSize(2)
                .containsEntry("httpd", HealthStatus.UP)
                .containsEntry("rabbitmq", HealthStatus.UP);
    }

    @Test
    @DisplayName("rejects null record")
    void rejectsNull() {
        assertThatThrownBy(() -> store.save(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("concurrent saves keep the greatest timestamp")
    void concurrentSaves() throws Exception {
        Instant base = Instant.parse("2024-01-15T10:00:00Z");
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String timestamp = base.plusSeconds(i).toString();
                HealthStatus status = i == 199 ? HealthStatus.DOWN : HealthStatus.UP;
                tasks.add(() -> {
                    store.save(record("postgresql", status, timestamp));
                    return null;
                });
            }
            for (Future<Void> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.latest("postgresql")).get()
                .satisfies(r -> {
                    assertThat(r.status()).isEqualTo(HealthStatus.DOWN);
                    assertThat(r.timestamp()).isEqualTo(base.plusSeconds(199).toString());
                });
    }
}
