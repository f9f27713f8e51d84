package com.healthwatch.statusapi.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the status API, bound from {@code healthwatch.api.*}.
 *
 * <pre>
 * healthwatch:
 *   api:
 *     name: status-api
 *     environment: production
 *     store-enabled: true
 *     allowed-origins: [http://localhost:3000]
 * </pre>
 *
 * @param name service name used in logs and metrics. Required.
 * @param environment deployment environment (development, staging, production)
 * @param storeEnabled whether the report store is available; when false every call answers 503
 * @param allowedOrigins origins allowed to call the API from a browser
 */
@ConfigurationProperties(prefix = "healthwatch.api")
@Validated
public record StatusApiProperties(
        @NotBlank String name, String environment, Boolean storeEnabled, List<String> allowedOrigins) {

    public StatusApiProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (storeEnabled == null) {
            storeEnabled = Boolean.TRUE;
        }
        allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
    }
}
