package com.healthwatch.statusapi.domain;

/**
 * Thrown when no record exists for a requested service. Mapped to 404 Not Found.
 */
public class StatusNotFoundException extends RuntimeException {

    private final String serviceName;

    public StatusNotFoundException(String serviceName) {
        super("Service \"" + serviceName + "\" not found");
        this.serviceName = serviceName;
    }

    public String serviceName() {
        return serviceName;
    }
}
