package com.healthwatch.statusapi.domain;

/**
 * Thrown when the report store cannot be reached. Mapped to 503 Service Unavailable.
 */
public class ReportStoreUnavailableException extends RuntimeException {

    public ReportStoreUnavailableException(String message) {
        super(message);
    }

    public ReportStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
