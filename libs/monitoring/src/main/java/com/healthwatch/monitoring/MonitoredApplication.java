package com.healthwatch.monitoring;

import java.util.List;

/**
 * The monitored application and the dependencies that must all be UP for it to be UP.
 *
 * @param name         application name used for the application-level record (e.g., "rbcapp1")
 * @param dependencies ordered dependency names; the complete membership required for the verdict
 */
public record MonitoredApplication(String name, List<String> dependencies) {

    /** Default application name. */
    public static final String DEFAULT_NAME = "rbcapp1";

    /** Default dependency set. */
    public static final List<String> DEFAULT_DEPENDENCIES = List.of("httpd", "rabbitmq", "postgresql");

    public MonitoredApplication {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("application name must not be null or blank");
        }
        if (dependencies == null || dependencies.isEmpty()) {
            throw new IllegalArgumentException("dependencies must not be empty");
        }
        if (dependencies.stream().anyMatch(d -> d == null || d.isBlank())) {
            throw new IllegalArgumentException("dependency names must not be null or blank");
        }
        dependencies = List.copyOf(dependencies);
    }

    /** Returns the default application with its default dependencies. */
    public static MonitoredApplication defaults() {
        return new MonitoredApplication(DEFAULT_NAME, DEFAULT_DEPENDENCIES);
    }
}
