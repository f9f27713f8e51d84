package com.healthwatch.statusapi.api;

import com.healthwatch.statusmodel.HealthStatus;
import com.healthwatch.statusmodel.StatusRecord;
import com.healthwatch.statusmodel.StatusRecordValidator;
import com.healthwatch.statusmodel.Timestamps;
import com.healthwatch.statusmodel.ValidationResult;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Turns an untyped {@code POST /add} payload into a {@link StatusRecord}.
 *
 * <p>Checks run in order and the first failing stage is reported:
 *
 * <ol>
 *   <li>empty payload
 *   <li>required fields missing or blank, all listed in one message
 *   <li>field types and the {@code service_status} value
 *   <li>timestamp format; an absent timestamp is assigned by the server
 * </ol>
 */
final class StatusRecordRequests {

    static final String SERVICE_NAME = "service_name";
    static final String SERVICE_STATUS = "service_status";
    static final String HOST_NAME = "host_name";
    static final String TIMESTAMP = "timestamp";

    private static final List<String> REQUIRED = List.of(SERVICE_NAME, SERVICE_STATUS, HOST_NAME);

    private StatusRecordRequests() {
        // utility class
    }

    static StatusRecord toRecord(Map<String, Object> body, Supplier<String> now) {
        if (body == null || body.isEmpty()) {
            throw new IngestValidationException("Empty JSON payload");
        }

        List<String> missing = REQUIRED.stream().filter(field -> isMissing(body.get(field))).toList();
        if (!missing.isEmpty()) {
            throw new IngestValidationException("Missing required fields: " + String.join(", ", missing));
        }

        String name = text(body, SERVICE_NAME);
        String host = text(body, HOST_NAME);
        HealthStatus status = HealthStatus.fromValue(text(body, SERVICE_STATUS))
                .orElseThrow(() -> new IngestValidationException(
                        "service_status must be one of: " + String.join(", ", HealthStatus.permittedValues())));

        String timestamp;
        if (body.get(TIMESTAMP) == null) {
            timestamp = now.get();
        } else {
            timestamp = text(body, TIMESTAMP);
            if (!Timestamps.isValid(timestamp)) {
                throw new IngestValidationException("timestamp must be in ISO 8601 format");
            }
        }

        ValidationResult result = StatusRecordValidator.validate(name, status, host, timestamp);
        if (!result.valid()) {
            throw new IngestValidationException(result.errors());
        }
        return new StatusRecord(name, status, host, timestamp);
    }

    private static boolean isMissing(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    private static String text(Map<String, Object> body, String field) {
        if (body.get(field) instanceof String s) {
            return s;
        }
        throw new IngestValidationException(field + " must be a string");
    }
}
