package com.healthwatch.statusapi.api.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.healthwatch.statusmodel.HealthStatus;
import java.util.Map;

/**
 * Body of {@code GET /healthcheck}: latest status per service.
 */
@JsonPropertyOrder({"services", "timestamp"})
public record HealthcheckResponse(Map<String, HealthStatus> services, String timestamp) {}
