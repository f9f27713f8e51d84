package com.healthwatch.monitoring;

/**
 * Thrown when a snapshot file cannot be written.
 */
public class SnapshotWriteException extends RuntimeException {

    private final String serviceName;

    public SnapshotWriteException(String message, String serviceName, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    /** Returns the service name of the record that failed to write. */
    public String serviceName() {
        return serviceName;
    }
}
