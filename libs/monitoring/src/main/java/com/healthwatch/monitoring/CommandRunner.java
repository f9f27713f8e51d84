package com.healthwatch.monitoring;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command with a bounded wait.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * Runs the command and waits at most {@code timeout} for it to finish.
     *
     * @param command program and arguments
     * @param timeout maximum wait
     * @return the exit code and output, or a timed-out result
     * @throws IOException          if the program cannot be started (e.g., not installed)
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;
}
