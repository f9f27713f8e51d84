package com.healthwatch.observability;

/**
 * Immutable correlation context for one unit of work: a monitoring pass or an HTTP request.
 * <p>
 * The values are pushed into SLF4J MDC by {@link CorrelationContextHolder} so that every log
 * line written while the work is in progress carries them.
 *
 * @param correlationId unique ID of the monitoring pass or request
 * @param component     Healthwatch component doing the work (e.g., "status-monitor", "status-api")
 * @param hostName      host the component runs on (nullable when not yet resolved)
 */
public record CorrelationContext(
        String correlationId,
        String component,
        String hostName
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for component name. */
    public static final String MDC_COMPONENT = "component";

    /** MDC key for host name. */
    public static final String MDC_HOST_NAME = "hostName";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context with only a correlation ID.
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null);
    }
}
