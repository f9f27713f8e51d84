package com.healthwatch.monitoring;

/**
 * Outcome of running an external command.
 *
 * @param exitCode process exit code (-1 when the command timed out)
 * @param stdout   captured standard output, never null
 * @param timedOut true if the command was abandoned after the timeout
 */
public record CommandResult(int exitCode, String stdout, boolean timedOut) {

    public CommandResult {
        stdout = stdout == null ? "" : stdout;
    }

    /** Result of a command that finished. */
    public static CommandResult completed(int exitCode, String stdout) {
        return new CommandResult(exitCode, stdout, false);
    }

    /** Result of a command that was abandoned. */
    public static CommandResult abandoned() {
        return new CommandResult(-1, "", true);
    }
}
