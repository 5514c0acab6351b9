package com.bank.txnrisk.exception;

import com.bank.txnrisk.config.MetricsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

/**
 * Global exception handler for REST API errors.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final MetricsConfig metricsConfig;

    public GlobalExceptionHandler(MetricsConfig metricsConfig) {
        this.metricsConfig = metricsConfig;
    }

    /**
     * Missing transaction_id or out-of-domain field values.
     */
    @ExceptionHandler(InvalidTransactionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransaction(InvalidTransactionException ex) {
        log.warn("Invalid transaction: {} ({})", ex.getMessage(), ex.getField());
        metricsConfig.recordInvalidInput(ex.getField());

        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "Invalid transaction",
            Map.of(ex.getField(), ex.getMessage()),
            Instant.now()
        ));
    }

    /**
     * Body is not valid JSON or a field has the wrong type.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMostSpecificCause().getMessage());

        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "Malformed request body",
            null,
            Instant.now()
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        // Spring MVC errors (unknown path, wrong method, ...) keep their own status
        if (ex instanceof org.springframework.web.ErrorResponse webError) {
            HttpStatusCode status = webError.getStatusCode();
            log.warn("Request rejected with {}: {}", status.value(), ex.getMessage());
            return ResponseEntity.status(status).body(new ErrorResponse(
                status.value(),
                ex.getMessage(),
                null,
                Instant.now()
            ));
        }

        log.error("Unexpected error occurred", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            "An unexpected error occurred",
            null,
            Instant.now()
        ));
    }
}
