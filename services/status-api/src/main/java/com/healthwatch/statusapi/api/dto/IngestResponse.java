package com.healthwatch.statusapi.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Body of a successful {@code POST /add}.
 */
@JsonPropertyOrder({"message", "service_name", "timestamp"})
public record IngestResponse(
        String message, @JsonProperty("service_name") String serviceName, String timestamp) {

    public static final String STORED = "Status data successfully stored";
}
