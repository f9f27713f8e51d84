package com.healthwatch.statusmodel;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StatusRecordValidator")
class StatusRecordValidatorTest {

    private static final String TS = "2024-01-15T10:30:00Z";

    @Test
    @DisplayName("valid fields pass")
    void validFieldsPass() {
        var result = StatusRecordValidator.validate("httpd", HealthStatus.UP, "web-01", TS);

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.message()).isEmpty();
    }

    @Nested
    @DisplayName("invalid fields")
    class InvalidFields {

        @Test
        @DisplayName("blank name fails")
        void blankName() {
            var result = StatusRecordValidator.validate(" ", HealthStatus.UP, "web-01", TS);
            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).anyMatch(e -> e.contains("service_name"));
        }

        @Test
        @DisplayName("unknown status lists the permitted values")
        void unknownStatus() {
            var result = StatusRecordValidator.validate("httpd", "MAYBE", "web-01", TS);
            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).containsExactly("service_status must be one of: UP, DOWN");
        }

        @Test
        @DisplayName("null host fails")
        void nullHost() {
            var result = StatusRecordValidator.validate("httpd", HealthStatus.DOWN, null, TS);
            assertThat(result.errors()).anyMatch(e -> e.contains("host_name"));
        }

        @Test
        @DisplayName("malformed timestamp fails")
        void malformedTimestamp() {
            var result = StatusRecordValidator.validate("httpd", HealthStatus.DOWN, "web-01", "15/01/2024");
            assertThat(result.errors()).containsExactly("timestamp must be in ISO 8601 format");
        }

        @Test
        @DisplayName("reports every violation at once")
        void reportsAllErrors() {
            var result = StatusRecordValidator.validate("", "", "", "");
            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).hasSize(4);
        }
    }
}
