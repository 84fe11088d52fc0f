package com.flagship.collateral_engine.api.exception;

import com.flagship.collateral_engine.engine.exception.EngineException;
import com.flagship.collateral_engine.engine.exception.ErrorCategory;
import com.flagship.collateral_engine.engine.exception.InvariantViolationException;
import com.flagship.collateral_engine.engine.exception.LiquidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps engine failures and request errors to consistent error responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(EngineException.class)
    public ResponseEntity<ErrorResponse> handleEngineException(EngineException e) {
        HttpStatus status = statusFor(e.getCategory());
        if (status.is5xxServerError()) {
            log.error("Engine dependency failure: code={}, message={}", e.getError(), e.getMessage());
        } else {
            log.warn("Engine rejected request: code={}, message={}", e.getError(), e.getMessage());
        }

        Map<String, String> details = new LinkedHashMap<>();
        details.put("category", e.getCategory().name());
        BigInteger healthFactor = healthFactorOf(e);
        if (healthFactor != null) {
            details.put("health_factor", healthFactor.toString());
        }

        ErrorResponse error = ErrorResponse.builder()
            .error(status.getReasonPhrase())
            .code(e.getError().name())
            .message(e.getMessage())
            .details(details)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ErrorResponse error = ErrorResponse.builder()
            .error("Missing Required Header")
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message("Request body could not be parsed")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(ErrorCategory category) {
        return switch (category) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case INVARIANT_VIOLATION -> HttpStatus.CONFLICT;
            case COLLABORATOR_FAILURE -> HttpStatus.BAD_GATEWAY;
            case ORACLE_FAILURE -> HttpStatus.SERVICE_UNAVAILABLE;
            case LIQUIDATION_NOT_ELIGIBLE, LIQUIDATION_INEFFECTIVE -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }

    private BigInteger healthFactorOf(EngineException e) {
        if (e instanceof InvariantViolationException violation) {
            return violation.getHealthFactor();
        }
        if (e instanceof LiquidationException liquidation) {
            return liquidation.getHealthFactor();
        }
        return null;
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
