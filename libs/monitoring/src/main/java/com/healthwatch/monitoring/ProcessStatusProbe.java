package com.healthwatch.monitoring;

import com.healthwatch.statusmodel.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * {@link StatusProbe} that asks systemd whether a unit is active.
 * <p>
 * Runs {@code systemctl is-active <name>} with a bounded wait. The dependency is UP only when
 * the command exits with 0 <em>and</em> prints {@code active}. Any other exit code or output, a
 * timeout, a missing {@code systemctl} binary or any other runner failure is reported as DOWN.
 * <p>
 * The host name is resolved once, at construction, and falls back to {@value #UNKNOWN_HOST}.
 */
public final class ProcessStatusProbe implements StatusProbe {

    private static final Logger log = LoggerFactory.getLogger(ProcessStatusProbe.class);

    /** Default supervisor binary. */
    public static final String DEFAULT_COMMAND = "systemctl";

    /** Default bound on a single supervisor call. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    /** Host name reported when the local host name cannot be resolved. */
    public static final String UNKNOWN_HOST = "unknown-host";

    private static final String ACTIVE = "active";

    private final CommandRunner runner;
    private final String command;
    private final Duration timeout;
    private final Clock clock;
    private final String hostName;

    /**
     * Creates a probe that runs {@code systemctl} with the default timeout.
     */
    public ProcessStatusProbe() {
        this(new ProcessCommandRunner(), DEFAULT_COMMAND, DEFAULT_TIMEOUT);
    }

    /**
     * Creates a probe with a custom runner, supervisor binary and timeout.
     */
    public ProcessStatusProbe(CommandRunner runner, String command, Duration timeout) {
        this(runner, command, timeout, Clock.systemUTC(), () -> InetAddress.getLocalHost().getHostName());
    }

    /**
     * Creates a fully specified probe.
     *
     * @param runner     runs the supervisor command
     * @param command    supervisor binary (e.g., "systemctl")
     * @param timeout    maximum wait for one supervisor call
     * @param clock      source for {@link #now()}
     * @param hostLookup resolves the local host name; called once
     */
    public ProcessStatusProbe(CommandRunner runner, String command, Duration timeout,
                              Clock clock, Callable<String> hostLookup) {
        if (runner == null) {
            throw new IllegalArgumentException("runner must not be null");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be null or blank");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.runner = runner;
        this.command = command;
        this.timeout = timeout;
        this.clock = clock;
        this.hostName = resolveHostName(hostLookup);
    }

    @Override
    public ProbeOutcome probe(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("service_name must be a non-empty string");
        }

        long start = System.nanoTime();
        try {
            CommandResult result = runner.run(List.of(command, "is-active", name), timeout);
            long latencyMs = elapsedMs(start);

            if (result.timedOut()) {
                log.error("Timeout checking service {}", name);
                return ProbeOutcome.down(name, "timed out after " + timeout.toMillis() + " ms", latencyMs);
            }

            String state = result.stdout().trim();
            if (result.exitCode() == 0 && ACTIVE.equals(state)) {
                log.info("Service {} is UP", name);
                return ProbeOutcome.up(name, state, latencyMs);
            }

            log.warn("Service {} is DOWN (status: {})", name, state);
            String reason = state.isEmpty()
                    ? "exit code " + result.exitCode()
                    : state + " (exit code " + result.exitCode() + ")";
            return ProbeOutcome.down(name, reason, latencyMs);
        } catch (IOException e) {
            log.error("{} command not available: {}", command, e.getMessage());
            return ProbeOutcome.down(name, command + " not available: " + e.getMessage(), elapsedMs(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while checking service {}", name);
            return ProbeOutcome.down(name, "interrupted", elapsedMs(start));
        } catch (RuntimeException e) {
            log.error("Unexpected error checking service {}: {}", name, e.getMessage());
            return ProbeOutcome.down(name, "unexpected error: " + e.getMessage(), elapsedMs(start));
        }
    }

    @Override
    public String currentHost() {
        return hostName;
    }

    @Override
    public String now() {
        return Timestamps.now(clock);
    }

    /** Returns the configured bound on a single supervisor call. */
    public Duration timeout() {
        return timeout;
    }

    private static String resolveHostName(Callable<String> hostLookup) {
        if (hostLookup == null) {
            return UNKNOWN_HOST;
        }
        try {
            String resolved = hostLookup.call();
            return resolved == null || resolved.isBlank() ? UNKNOWN_HOST : resolved;
        } catch (Exception e) {
            log.error("Failed to get hostname: {}", e.getMessage());
            return UNKNOWN_HOST;
        }
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
