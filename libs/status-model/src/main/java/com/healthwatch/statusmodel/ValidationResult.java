package com.healthwatch.statusmodel;

import java.util.List;

/**
 * Result of validating the fields of a {@link StatusRecord}.
 *
 * @param valid true if validation passed with no errors
 * @param errors list of human-readable error messages (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    /** Convenience factory for a successful validation. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Convenience factory for a failed validation. */
    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, errors);
    }

    /** Joins all errors into a single message, or returns an empty string when valid. */
    public String message() {
        return String.join("; ", errors);
    }
}
