package com.healthwatch.statusmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates the four fields of a {@link StatusRecord} and reports every violation at once.
 * <p>
 * The record's canonical constructor delegates here, so no invalid record can be created.
 * The status API also calls it before constructing a record, to build a client-facing message.
 */
public final class StatusRecordValidator {

    private StatusRecordValidator() {
        // utility class
    }

    /**
     * Validates typed fields.
     *
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(String name, HealthStatus status, String host, String timestamp) {
        List<String> errors = new ArrayList<>();

        if (isBlank(name)) {
            errors.add("service_name must be a non-empty string");
        }
        if (status == null) {
            errors.add("service_status must be one of: " + String.join(", ", HealthStatus.permittedValues()));
        }
        if (isBlank(host)) {
            errors.add("host_name must be a non-empty string");
        }
        checkTimestamp(timestamp, errors);

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /**
     * Validates untyped fields, where the status arrives as a raw string.
     *
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(String name, String status, String host, String timestamp) {
        return validate(name, HealthStatus.fromValue(status).orElse(null), host, timestamp);
    }

    private static void checkTimestamp(String timestamp, List<String> errors) {
        if (isBlank(timestamp)) {
            errors.add("timestamp must be a non-empty string");
        } else if (!Timestamps.isValid(timestamp)) {
            errors.add("timestamp must be in ISO 8601 format");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
