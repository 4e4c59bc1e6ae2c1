package com.medledger.consentservice.exceptions;

import com.medledger.consentservice.dto.ErrorResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps engine error kinds onto HTTP status codes so callers can tell a denial
 * (403) from a dependency outage (503).
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ConsentEngineException.class)
    public ResponseEntity<ErrorResponse> handleEngineException(ConsentEngineException e) {
        ErrorKind kind = e.getKind();
        if (kind.getStatus().is5xxServerError()) {
            log.error("Request failed with {}: {}", kind, e.getMessage());
        } else {
            log.warn("Request rejected with {}: {}", kind, e.getMessage());
        }

        Long retryAfter = e instanceof RateLimitExceededException
                ? ((RateLimitExceededException) e).getRetryAfterSeconds()
                : null;

        return ResponseEntity.status(kind.getStatus()).body(ErrorResponse.builder()
                .success(false)
                .code(kind.name())
                .message(e.getMessage())
                .retryable(kind.isRetryable())
                .retryAfter(retryAfter)
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return badRequest(message);
    }

    @ExceptionHandler({ConstraintViolationException.class, HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
        return badRequest(e.getMessage());
    }

    @ExceptionHandler({DataIntegrityViolationException.class, OptimisticLockingFailureException.class})
    public ResponseEntity<ErrorResponse> handleConcurrentWrite(Exception e) {
        log.warn("Concurrent write rejected: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.builder()
                .success(false)
                .code(ErrorKind.CONFLICT.name())
                .message("The resource was modified concurrently, please retry")
                .retryable(true)
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error while handling request", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.builder()
                .success(false)
                .code(ErrorKind.INTERNAL.name())
                .message("An unexpected error occurred")
                .retryable(false)
                .timestamp(Instant.now())
                .build());
    }

    private ResponseEntity<ErrorResponse> badRequest(String message) {
        log.warn("Malformed request: {}", message);
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .success(false)
                .code(ErrorKind.VALIDATION.name())
                .message(message)
                .retryable(false)
                .timestamp(Instant.now())
                .build());
    }
}
