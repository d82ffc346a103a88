package com.restaurantguide.search.presentation.exception;

import com.restaurantguide.search.application.service.EstablishmentDetailService;
import com.restaurantguide.search.application.service.EstablishmentSearchService;
import com.restaurantguide.search.application.validation.SearchValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler providing consistent JSON error responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SearchValidationException.class)
    public ResponseEntity<Map<String, Object>> handleSearchValidationException(SearchValidationException ex) {
        logger.debug("Validation error: {}", ex.getMessage());

        Map<String, Object> error = new HashMap<>();
        error.put("error", "VALIDATION_ERROR");
        error.put("message", "Validation failed");
        error.put("fieldErrors", ex.getViolations());

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatchException(MethodArgumentTypeMismatchException ex) {
        logger.debug("Type mismatch error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "INVALID_PARAMETER");
        error.put("message", "Invalid parameter type: " + ex.getName());
        error.put("parameter", ex.getName());
        error.put("expectedType", ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        logger.debug("Illegal argument error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "INVALID_INPUT");
        error.put("message", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(EstablishmentDetailService.EstablishmentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFoundException(
            EstablishmentDetailService.EstablishmentNotFoundException ex) {
        logger.debug("Not found: {}", ex.getMessage());

        Map<String, Object> error = new HashMap<>();
        error.put("error", "NOT_FOUND");
        error.put("message", ex.getMessage());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(EstablishmentSearchService.SearchUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleSearchUnavailableException(
            EstablishmentSearchService.SearchUnavailableException ex) {
        logger.error("Search unavailable", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "SEARCH_UNAVAILABLE");
        error.put("message", ex.getMessage());
        error.put("retryable", true);

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        logger.error("Unexpected error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "INTERNAL_ERROR");
        error.put("message", "An unexpected error occurred");

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
