package com.arkham.orders.infrastructure.web;

import com.arkham.logging.LoggingManager;
import com.arkham.logging.tracing.TracingContext;
import com.arkham.orders.domain.InsufficientStockException;
import com.arkham.orders.domain.OrderNotFoundException;
import java.net.URI;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Every response carries {@code timestamp} and, when a trace is current, {@code trace_id}, so
 * a client can quote the id that ties the response to its wide event:
 *
 * <pre>
 * {
 *   "type": "https://arkham.dev/errors/insufficient-stock",
 *   "title": "Insufficient Stock",
 *   "status": 409,
 *   "detail": "Insufficient stock for SKU-1: requested 500",
 *   "timestamp": "2026-01-15T10:30:00Z",
 *   "trace_id": "trace_3f2a..."
 * }
 * </pre>
 *
 * <p>Unexpected failures are logged through the pipeline with their context.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String ERROR_TYPE_BASE = "https://arkham.dev/errors/";

    private final LoggingManager loggingManager;
    private final Logger log;

    public GlobalExceptionHandler(LoggingManager loggingManager) {
        this.loggingManager = loggingManager;
        this.log = loggingManager.getLogger(GlobalExceptionHandler.class);
    }

    @ExceptionHandler(OrderNotFoundException.class)
    public ProblemDetail handleNotFound(OrderNotFoundException ex) {
        log.info("Order not found: {}", ex.getOrderId());
        return problem(HttpStatus.NOT_FOUND, "Order Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ProblemDetail handleInsufficientStock(InsufficientStockException ex) {
        log.warn("Insufficient stock: sku={} requested={}", ex.getSku(), ex.getRequested());
        return problem(
                HttpStatus.CONFLICT, "Insufficient Stock", "insufficient-stock", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(
                HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Malformed request body");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        log.warn("Validation failed: {}", detail);
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        loggingManager
                .errorReporting()
                .logErrorWithContext(
                        log,
                        "Unhandled request failure",
                        ex,
                        Map.of("exception_type", ex.getClass().getSimpleName()));
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        loggingManager
                .tracing()
                .get()
                .ifPresent(traceId -> problem.setProperty(TracingContext.MDC_TRACE_ID, traceId));
        return problem;
    }
}
