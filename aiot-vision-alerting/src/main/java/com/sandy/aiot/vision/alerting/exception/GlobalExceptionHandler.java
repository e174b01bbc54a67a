package com.sandy.aiot.vision.alerting.exception;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders every failure as {timestamp, status, error, message, detail} where error is the stable kind.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final Clock clock;

    /** Business and lifecycle errors: logged without stack trace. */
    @ExceptionHandler(AlertingException.class)
    public ResponseEntity<Map<String, Object>> handleAlerting(AlertingException ex) {
        if (ex.getKind() == ErrorKind.INTERNAL || ex.getKind() == ErrorKind.STORE_UNAVAILABLE) {
            log.error("Alerting failure {}: {}", ex.getKind(), ex.getMessage(), ex);
        } else {
            log.warn("Request rejected {}: {}", ex.getKind(), ex.getMessage());
        }
        return body(ex.getKind().getStatus(), ex.getKind(), ex.getMessage(), ex.getDetail());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        String message = ex instanceof HttpMessageNotReadableException ? "Malformed request body" : ex.getMessage();
        return body(ErrorKind.VALIDATION.getStatus(), ErrorKind.VALIDATION, message, Map.of());
    }

    /** A uniqueness constraint lost to a concurrent writer. */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> handleIntegrity(DataIntegrityViolationException ex) {
        log.warn("Integrity conflict: {}", ex.getMostSpecificCause().getMessage());
        return body(ErrorKind.CONFLICT.getStatus(), ErrorKind.CONFLICT, "Conflicting concurrent update", Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        if (ex instanceof ErrorResponse er) {
            // framework errors such as unknown paths or unsupported methods keep their own status
            log.warn("Request failed {}: {}", er.getStatusCode(), ex.getMessage());
            ErrorKind kind = er.getStatusCode().value() == 404 ? ErrorKind.NOT_FOUND : ErrorKind.VALIDATION;
            return body(er.getStatusCode(), kind, ex.getMessage(), Map.of());
        }
        log.error("Unexpected error", ex);
        return body(ErrorKind.INTERNAL.getStatus(), ErrorKind.INTERNAL, "An unexpected error occurred", Map.of());
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatusCode status, ErrorKind kind, String message,
                                                     Map<String, Object> detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", clock.instant().toString());
        body.put("status", status.value());
        body.put("error", kind.name());
        body.put("message", message);
        body.put("detail", detail);
        return ResponseEntity.status(status).body(body);
    }
}
