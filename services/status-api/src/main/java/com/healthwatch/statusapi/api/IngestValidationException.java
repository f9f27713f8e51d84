package com.healthwatch.statusapi.api;

import java.util.List;

/**
 * Thrown when an ingest payload is rejected. Mapped to 400 Bad Request.
 */
public class IngestValidationException extends RuntimeException {

    private final List<String> errors;

    public IngestValidationException(String error) {
        this(List.of(error));
    }

    public IngestValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /** Returns every violation found in the payload. */
    public List<String> errors() {
        return errors;
    }
}
