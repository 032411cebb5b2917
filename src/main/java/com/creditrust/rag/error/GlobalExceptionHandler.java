package com.creditrust.rag.error;

import java.time.Instant;
import java.util.UUID;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions of the REST controllers to {@link ApiError}
 * responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CapabilityException.class)
    public ResponseEntity<ApiError> handleCapability(CapabilityException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.error("Capability unavailable [{}]: {}", errorId, ex.getMessage(), ex);
        String code = ex instanceof EmbeddingUnavailableException ? ApiError.EMBEDDING_UNAVAILABLE
                : ApiError.GENERATION_UNAVAILABLE;
        return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, code, ex.getUserMessage(), request);
    }

    @ExceptionHandler(IndexCorruptionException.class)
    public ResponseEntity<ApiError> handleCorruption(IndexCorruptionException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.error("Index corrupted [{}]: {}", errorId, ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.INDEX_CORRUPTED,
                "The complaint index is damaged and is being rebuilt. Please try again later.", request);
    }

    @ExceptionHandler(IndexNotReadyException.class)
    public ResponseEntity<ApiError> handleNotReady(IndexNotReadyException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.warn("Index not ready [{}]: {}", errorId, ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.INDEX_NOT_READY,
                "The complaint index is not available yet. Please try again later.", request);
    }

    @ExceptionHandler(IndexBuildInProgressException.class)
    public ResponseEntity<ApiError> handleBuildInProgress(IndexBuildInProgressException ex,
            HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.warn("Rejected rebuild [{}]: {}", errorId, ex.getMessage());
        return respond(HttpStatus.CONFLICT, errorId, ApiError.INDEX_BUILD_IN_PROGRESS, ex.getMessage(), request);
    }

    @ExceptionHandler(DataException.class)
    public ResponseEntity<ApiError> handleData(DataException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.warn("Data error [{}]: {}", errorId, ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, errorId, ApiError.INVALID_DATA, ex.getMessage(), request);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.error("Configuration error [{}]: {}", errorId, ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.INVALID_CONFIGURATION, ex.getMessage(),
                request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .orElse("Validation failed");
        LOGGER.warn("Validation error [{}]: {}", errorId, message);
        return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
    }

    @ExceptionHandler({ ConstraintViolationException.class, IllegalArgumentException.class })
    public ResponseEntity<ApiError> handleIllegalArgument(RuntimeException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.warn("Invalid request [{}]: {}", errorId, ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.INTERNAL_ERROR,
                "An unexpected error occurred. Please try again later.", request);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String errorId, String code, String message,
            HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(new ApiError(errorId, code, message, request.getRequestURI(), Instant.now()));
    }

    private static String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
