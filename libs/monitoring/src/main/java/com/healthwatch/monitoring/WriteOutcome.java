package com.healthwatch.monitoring;

import java.nio.file.Path;

/**
 * Result of writing one snapshot in a batch.
 *
 * @param name    service name of the record
 * @param path    written file, null on failure
 * @param failure failure description, null on success
 */
public record WriteOutcome(String name, Path path, String failure) {

    /** Creates a successful outcome. */
    public static WriteOutcome written(String name, Path path) {
        return new WriteOutcome(name, path, null);
    }

    /** Creates a failed outcome. */
    public static WriteOutcome failed(String name, String failure) {
        return new WriteOutcome(name, null, failure);
    }

    /** Returns true if the snapshot was written. */
    public boolean succeeded() {
        return path != null;
    }
}
