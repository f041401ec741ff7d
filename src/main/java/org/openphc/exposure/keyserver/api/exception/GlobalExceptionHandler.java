package org.openphc.exposure.keyserver.api.exception;

import lombok.extern.slf4j.Slf4j;
import org.openphc.exposure.keyserver.api.dto.ApiResponse;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps publish failures onto HTTP responses. Validation kinds become the error code.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PublishValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handlePublishValidation(PublishValidationException ex) {
        log.warn("Publish validation failed: {} ({})", ex.getMessage(), ex.getKind());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ex.getKind().name(), ex.getMessage(), ex.getDetails()));
    }

    @ExceptionHandler(UnauthorizedAppException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnauthorizedApp(UnauthorizedAppException ex) {
        log.warn("Unauthorized publish: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ApiResponse.error("UNAUTHORIZED_APP", ex.getMessage()));
    }

    @ExceptionHandler(AttestationFailedException.class)
    public ResponseEntity<ApiResponse<Void>> handleAttestationFailed(AttestationFailedException ex) {
        log.warn("Attestation failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ApiResponse.error("ATTESTATION_FAILED", "unable to verify device attestation"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleBeanValidation(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Bean validation failed: {}", errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("VALIDATION_ERROR", errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable publish body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("BAD_REQUEST", "request body could not be parsed"));
    }

    // exposure_key is unique: a key that was already published
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleDuplicateKey(DataIntegrityViolationException ex) {
        log.warn("Publish conflicts with stored exposures: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.error("DUPLICATE_KEY", "one or more exposure keys were already published"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("INTERNAL_ERROR", "An unexpected error occurred"));
    }
}
