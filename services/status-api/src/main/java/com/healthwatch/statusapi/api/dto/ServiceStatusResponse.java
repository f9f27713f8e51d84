package com.healthwatch.statusapi.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.healthwatch.statusmodel.HealthStatus;
import com.healthwatch.statusmodel.StatusRecord;

/**
 * Body of {@code GET /healthcheck/{serviceName}}.
 *
 * @param lastUpdated timestamp carried by the stored record
 * @param timestamp time the response was produced
 */
@JsonPropertyOrder({"service_name", "service_status", "host_name", "last_updated", "timestamp"})
public record ServiceStatusResponse(
        @JsonProperty("service_name") String serviceName,
        @JsonProperty("service_status") HealthStatus serviceStatus,
        @JsonProperty("host_name") String hostName,
        @JsonProperty("last_updated") String lastUpdated,
        @JsonProperty("timestamp") String timestamp) {

    public static ServiceStatusResponse of(StatusRecord record, String now) {
        return new ServiceStatusResponse(record.name(), record.status(), record.host(), record.timestamp(), now);
    }
}
