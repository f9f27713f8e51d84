package com.healthwatch.statusmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StatusRecord")
class StatusRecordTest {

    private static final String TS = "2024-01-15T10:30:00.123456Z";

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("accepts valid fields")
        void acceptsValidFields() {
            var record = new StatusRecord("httpd", HealthStatus.UP, "web-01", TS);

            assertThat(record.name()).isEqualTo("httpd");
            assertThat(record.status()).isEqualTo(HealthStatus.UP);
            assertThat(record.host()).isEqualTo("web-01");
            assertThat(record.timestamp()).isEqualTo(TS);
            assertThat(record.isUp()).isTrue();
        }

        @Test
        @DisplayName("accepts a timestamp without offset")
        void acceptsLocalTimestamp() {
            var record = new StatusRecord("httpd", HealthStatus.DOWN, "web-01", "2024-01-15T10:30:00");
            assertThat(record.isUp()).isFalse();
        }

        @Test
        @DisplayName("rejects empty name")
        void rejectsEmptyName() {
            assertThatThrownBy(() -> new StatusRecord("", HealthStatus.UP, "web-01", TS))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("service_name");
        }

        @Test
        @DisplayName("rejects null status")
        void rejectsNullStatus() {
            assertThatThrownBy(() -> new StatusRecord("httpd", null, "web-01", TS))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("service_status");
        }

        @Test
        @DisplayName("rejects empty host")
        void rejectsEmptyHost() {
            assertThatThrownBy(() -> new StatusRecord("httpd", HealthStatus.UP, "", TS))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("host_name");
        }

        @Test
        @DisplayName("rejects date-only timestamp")
        void rejectsDateOnly() {
            assertThatThrownBy(() -> new StatusRecord("httpd", HealthStatus.UP, "web-01", "2024-01-15"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("ISO 8601");
        }

        @Test
        @DisplayName("rejects timestamp padded with whitespace")
        void rejectsPaddedTimestamp() {
            assertThatThrownBy(() -> new StatusRecord("httpd", HealthStatus.UP, "web-01", " 2024-01-15T10:30:00Z\n"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("ISO 8601");
        }
    }

    @Nested
    @DisplayName("of() with untyped status")
    class UntypedFactory {

        @Test
        @DisplayName("parses UP and DOWN")
        void parsesKnownValues() {
            assertThat(StatusRecord.of("httpd", "UP", "web-01", TS).status()).isEqualTo(HealthStatus.UP);
            assertThat(StatusRecord.of("httpd", "DOWN", "web-01", TS).status()).isEqualTo(HealthStatus.DOWN);
        }

        @Test
        @DisplayName("rejects values outside UP and DOWN")
        void rejectsUnknownValue() {
            assertThatThrownBy(() -> StatusRecord.of("httpd", "MAYBE", "web-01", TS))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("UP, DOWN");
        }
    }

    @Test
    @DisplayName("records with identical fields are equal")
    void valueEquality() {
        var r1 = new StatusRecord("httpd", HealthStatus.UP, "web-01", TS);
        var r2 = StatusRecord.of("httpd", "UP", "web-01", TS);

        assertThat(r1).isEqualTo(r2);
        assertThat(r1.hashCode()).isEqualTo(r2.hashCode());
    }
}
