package io.github.samzhu.finops.controller;

import java.time.Instant;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import io.github.samzhu.finops.dto.api.ErrorResponse;
import io.github.samzhu.finops.exception.SourceAccessDeniedException;
import io.github.samzhu.finops.exception.UnknownAllocationMethodException;

/**
 * REST API 例外對應。
 *
 * <ul>
 *   <li>{@link UnknownAllocationMethodException} → 400</li>
 *   <li>{@link SourceAccessDeniedException} → 503，需要人工處理來源權限</li>
 * </ul>
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionAdvice.class);

    @ExceptionHandler(UnknownAllocationMethodException.class)
    public ResponseEntity<ErrorResponse> handleUnknownMethod(
            UnknownAllocationMethodException ex, HttpServletRequest request) {
        log.warn("Rejected request {}: {}", request.getRequestURI(), ex.getMessage());
        return response(HttpStatus.BAD_REQUEST, "unknown_allocation_method", ex.getMessage(), request);
    }

    @ExceptionHandler(SourceAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(
            SourceAccessDeniedException ex, HttpServletRequest request) {
        return response(HttpStatus.SERVICE_UNAVAILABLE, "source_access_denied", ex.getMessage(), request);
    }

    private static ResponseEntity<ErrorResponse> response(
            HttpStatus status, String error, String message, HttpServletRequest request) {
        return ResponseEntity.status(status)
            .body(new ErrorResponse(status.value(), error, message, request.getRequestURI(), Instant.now()));
    }
}
