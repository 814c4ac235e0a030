package com.dtech.accountservice.infrastructure.web;

import com.dtech.accountservice.domain.AccountException;
import com.dtech.observability.CorrelationContextHolder;
import com.dtech.security.AuthorizationException;
import com.dtech.security.SecurityMisconfigurationException;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} bodies carrying a timestamp and the correlation id.
 *
 * <pre>
 * {
 *   "type": "https://dtech.com/errors/forbidden",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "Your plan status does not allow this action",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://dtech.com/errors/";

    @ExceptionHandler(AuthorizationException.class)
    public ProblemDetail handleAuthorization(AuthorizationException ex) {
        return problem(HttpStatus.valueOf(ex.kind().httpStatus()), ex.failure().message());
    }

    @ExceptionHandler(AccountException.class)
    public ProblemDetail handleAccount(AccountException ex) {
        log.info("Request rejected with {}: {}", ex.status().value(), ex.getMessage());
        return problem(ex.status(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .sorted()
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        log.warn("Validation failed: {}", detail);
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "validation"));
        return problem;
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        String detail = ex instanceof HttpMessageNotReadableException ? "Malformed request body" : ex.getMessage();
        return problem(HttpStatus.BAD_REQUEST, detail);
    }

    @ExceptionHandler(SecurityMisconfigurationException.class)
    public ProblemDetail handleMisconfiguration(SecurityMisconfigurationException ex) {
        log.error("Security misconfiguration", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse) {
            // Spring MVC's own failures (unknown path, unsupported method) carry their status.
            ErrorResponse response = (ErrorResponse) ex;
            HttpStatus status = HttpStatus.valueOf(response.getStatusCode().value());
            log.warn("Request failed with {}: {}", status.value(), ex.getMessage());
            return problem(status, response.getBody().getDetail());
        }
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + status.name().toLowerCase(Locale.ROOT).replace('_', '-')));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get().ifPresent(context -> problem.setProperty("correlationId", context.correlationId()));
        return problem;
    }
}
