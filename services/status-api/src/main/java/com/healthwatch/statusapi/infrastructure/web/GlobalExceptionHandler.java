package com.healthwatch.statusapi.infrastructure.web;

import com.healthwatch.observability.CorrelationContextHolder;
import com.healthwatch.statusapi.api.IngestValidationException;
import com.healthwatch.statusapi.domain.ReportStoreUnavailableException;
import com.healthwatch.statusapi.domain.StatusNotFoundException;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://healthwatch.dev/errors/bad-request",
 *   "title": "Bad Request",
 *   "status": 400,
 *   "detail": "Missing required fields: host_name",
 *   "error": "bad_request",
 *   "timestamp": "2024-01-15T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://healthwatch.dev/errors/";

    @ExceptionHandler(IngestValidationException.class)
    public ProblemDetail handleIngestValidation(IngestValidationException ex) {
        log.warn("Rejected status payload: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "Validation Error", "validation");
        problem.setProperty("errors", ex.errors());
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "Bad Request", "bad-request");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Request body must be a JSON object", "Bad Request", "bad-request");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ProblemDetail handleMediaType(HttpMediaTypeNotSupportedException ex) {
        log.warn("Unsupported content type: {}", ex.getContentType());
        return problem(HttpStatus.BAD_REQUEST, "Request must be JSON", "Bad Request", "bad-request");
    }

    @ExceptionHandler(StatusNotFoundException.class)
    public ProblemDetail handleNotFound(StatusNotFoundException ex) {
        log.info("No status stored for {}", ex.serviceName());
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "Not Found", "not-found");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ProblemDetail handleNoResource(NoResourceFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Resource not found", "Not Found", "not-found");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ProblemDetail handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return problem(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage(), "Method Not Allowed", "method-not-allowed");
    }

    @ExceptionHandler(ReportStoreUnavailableException.class)
    public ProblemDetail handleStoreUnavailable(ReportStoreUnavailableException ex) {
        log.error("Report store unavailable: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), "Service Unavailable", "service-unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred",
                "Internal Server Error", "internal");
    }

    private ProblemDetail problem(HttpStatus status, String detail, String title, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("error", errorCode(status));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.correlationId().ifPresent(id -> problem.setProperty("correlationId", id));
        return problem;
    }

    private static String errorCode(HttpStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }
}
