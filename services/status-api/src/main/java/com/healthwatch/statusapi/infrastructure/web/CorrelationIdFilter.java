package com.healthwatch.statusapi.infrastructure.web;

import com.healthwatch.observability.CorrelationContext;
import com.healthwatch.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates the client's {@code X-Correlation-ID} or generates one, for every request.
 *
 * <p>The ID is held in a {@link CorrelationContextHolder.Scope} (and therefore in the logging MDC)
 * while the request is handled, and echoed on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    static final String COMPONENT = "status-api";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        // restores whatever the pooled thread held before, normally nothing
        try (CorrelationContextHolder.Scope ignored =
                CorrelationContextHolder.open(new CorrelationContext(correlationId, COMPONENT, null))) {
            response.setHeader(CORRELATION_ID_HEADER, correlationId);
            filterChain.doFilter(request, response);
        }
    }
}
