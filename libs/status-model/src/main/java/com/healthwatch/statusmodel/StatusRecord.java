package com.healthwatch.statusmodel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Health of one dependency, or of the monitored application, at a point in time.
 *
 * <p>All four fields are validated by the canonical constructor; construction fails with an
 * {@link IllegalArgumentException} naming every violated field and no instance is created.
 * Records with identical fields are interchangeable.
 *
 * @param name service identifier, serialized as {@code service_name}
 * @param status UP or DOWN, serialized as {@code service_status}
 * @param host reporting machine, serialized as {@code host_name}
 * @param timestamp ISO-8601 date-time of the check
 */
@JsonPropertyOrder({"service_name", "service_status", "host_name", "timestamp"})
public record StatusRecord(
        @JsonProperty("service_name") String name,
        @JsonProperty("service_status") HealthStatus status,
        @JsonProperty("host_name") String host,
        @JsonProperty("timestamp") String timestamp) {

    public StatusRecord {
        ValidationResult result = StatusRecordValidator.validate(name, status, host, timestamp);
        if (!result.valid()) {
            throw new IllegalArgumentException("Invalid status record: " + result.message());
        }
    }

    /**
     * Creates a record from an untyped status value.
     *
     * @throws IllegalArgumentException if any field is invalid, including a status other than UP or DOWN
     */
    public static StatusRecord of(String name, String status, String host, String timestamp) {
        ValidationResult result = StatusRecordValidator.validate(name, status, host, timestamp);
        if (!result.valid()) {
            throw new IllegalArgumentException("Invalid status record: " + result.message());
        }
        return new StatusRecord(name, HealthStatus.fromValue(status).orElseThrow(), host, timestamp);
    }

    /** Returns true if this record reports {@link HealthStatus#UP}. */
    @JsonIgnore
    public boolean isUp() {
        return status.isUp();
    }
}
