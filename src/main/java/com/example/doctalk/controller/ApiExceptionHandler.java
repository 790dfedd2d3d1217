package com.example.doctalk.controller;

import com.example.doctalk.exception.GenerationException;
import com.example.doctalk.exception.InvalidRequestException;
import com.example.doctalk.exception.NotFoundException;
import com.example.doctalk.exception.RateGateUnavailableException;
import com.example.doctalk.exception.RateLimitExceededException;
import com.example.doctalk.exception.UnauthenticatedException;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to {@code {"error": "..."}} bodies. Internal details stay in the log.
 * <p>
 * A streamed answer that fails after its first chunk already has a committed text/plain
 * response; such errors are rethrown so the container aborts the connection instead of
 * ending the body normally.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<Map<String, String>> handleUnauthenticated(UnauthenticatedException ex) {
        return error(HttpStatus.UNAUTHORIZED, new HttpHeaders(), ex.getMessage());
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, String>> handleRateLimited(RateLimitExceededException ex) {
        HttpHeaders headers = RateLimitHeaders.of(ex.getDecision());
        headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()));
        return error(HttpStatus.TOO_MANY_REQUESTS, headers, ex.getMessage());
    }

    @ExceptionHandler(RateGateUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleGateUnavailable(RateGateUnavailableException ex) {
        log.error("Rate limiter backend unavailable, rejecting request", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, new HttpHeaders(), ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(NotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, new HttpHeaders(), ex.getMessage());
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, String>> handleInvalid(InvalidRequestException ex) {
        return error(HttpStatus.BAD_REQUEST, new HttpHeaders(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .map(field -> field + " is invalid")
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, new HttpHeaders(), message.isEmpty() ? "Invalid request" : message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> handleUnreadable(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, new HttpHeaders(), "Invalid request");
    }

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<Map<String, String>> handleGeneration(GenerationException ex, HttpServletResponse response) {
        if (response.isCommitted()) {
            log.warn("Answer stream failed after the response started, aborting it: {}", ex.getMessage());
            throw ex;
        }
        return error(HttpStatus.BAD_GATEWAY, new HttpHeaders(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception ex, HttpServletResponse response) throws Exception {
        if (response.isCommitted()) {
            log.error("Error after the response was committed, aborting it", ex);
            throw ex;
        }
        log.error("Unhandled error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, new HttpHeaders(), "Internal server error");
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, HttpHeaders headers, String message) {
        return ResponseEntity.status(status)
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", message));
    }
}
