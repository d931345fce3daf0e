package com.ledger.order.api;

import com.ledger.order.exception.OrderException;
import com.ledger.shared.eventstore.ConcurrencyConflictException;
import com.ledger.shared.support.OperationTimeoutException;
import com.ledger.shared.support.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.net.URI;
import java.time.Instant;

/**
 * Maps order and infrastructure failures to RFC 7807 problem details.
 * Spring MVC's own exceptions (binding, body validation, unreadable JSON) are handled by the base class.
 */
@Slf4j
@RestControllerAdvice
public class RestExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(OrderException.class)
    public ResponseEntity<ProblemDetail> handleOrderException(OrderException ex, WebRequest request) {
        HttpStatus status = switch (ex.getCode()) {
            case VALIDATION_ERROR, EMPTY_ORDER -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DELETED, ALREADY_DELETED -> HttpStatus.GONE;
            case ID_MISMATCH, INVALID_TRANSITION, INVALID_STATE, ALREADY_EXISTS -> HttpStatus.CONFLICT;
        };
        log.warn("Order request rejected: code={}, message={}", ex.getCode(), ex.getMessage());

        ProblemDetail problem = problem(status, ex.getMessage(), request);
        problem.setTitle(title(ex.getCode().name()));
        problem.setProperty("code", ex.getCode().name());
        return ResponseEntity.status(status).body(problem);
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<ProblemDetail> handleConflict(ConcurrencyConflictException ex, WebRequest request) {
        ProblemDetail problem = problem(HttpStatus.CONFLICT, ex.getMessage(), request);
        problem.setTitle("Concurrency Conflict");
        problem.setProperty("code", "CONCURRENCY_CONFLICT");
        problem.setProperty("retryable", true);
        problem.setProperty("expectedVersion", ex.getExpectedVersion());
        problem.setProperty("actualVersion", ex.getActualVersion());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleStorageUnavailable(StorageUnavailableException ex, WebRequest request) {
        log.error("Storage unavailable: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.SERVICE_UNAVAILABLE, "Storage is temporarily unavailable", request);
        problem.setTitle("Storage Unavailable");
        problem.setProperty("code", "STORAGE_UNAVAILABLE");
        problem.setProperty("retryable", true);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
    }

    /**
     * The deadline elapsed; whether a write was applied is unknown, so callers re-read before retrying.
     */
    @ExceptionHandler(OperationTimeoutException.class)
    public ResponseEntity<ProblemDetail> handleTimeout(OperationTimeoutException ex, WebRequest request) {
        log.warn("Request timed out: operation={}, timeoutMs={}", ex.getOperation(), ex.getTimeout().toMillis());
        ProblemDetail problem = problem(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage(), request);
        problem.setTitle("Timeout");
        problem.setProperty("code", "TIMEOUT");
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex, WebRequest request) {
        log.warn("Invalid request argument: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
        problem.setTitle("Validation Error");
        problem.setProperty("code", "VALIDATION_ERROR");
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, WebRequest request) {
        log.error("Handling unexpected exception: {}", ex.getMessage(), ex);
        ProblemDetail problem = problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected internal error occurred.", request);
        problem.setTitle("Internal Server Error");
        return ResponseEntity.internalServerError().body(problem);
    }

    private static ProblemDetail problem(HttpStatus status, String detail, WebRequest request) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setProperty("timestamp", Instant.now());
        problem.setInstance(URI.create(request.getDescription(false).replaceFirst("^uri=", "")));
        return problem;
    }

    private static String title(String code) {
        StringBuilder title = new StringBuilder();
        for (String word : code.split("_")) {
            if (!title.isEmpty()) {
                title.append(' ');
            }
            title.append(word.charAt(0)).append(word.substring(1).toLowerCase());
        }
        return title.toString();
    }
}
