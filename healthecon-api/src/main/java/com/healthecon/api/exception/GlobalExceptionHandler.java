package com.healthecon.api.exception;

import com.healthecon.api.dto.response.ErrorResponse;
import com.healthecon.common.exception.BillNotFoundException;
import com.healthecon.common.exception.QueryNotFoundException;
import com.healthecon.common.exception.StorageException;
import com.healthecon.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        StringBuilder errors = new StringBuilder();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.append(field).append(": ").append(error.getDefaultMessage()).append("; ");
        });
        return respond(HttpStatus.BAD_REQUEST, "Validation failed", errors.toString().trim(), request);
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleDomainValidation(ValidationException ex, WebRequest request) {
        log.warn("[API] Request rejected | path={} | reason={}", path(request), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage(), request);
    }
    
    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex, WebRequest request) {
        log.warn("[API] Malformed request | path={} | error={}", path(request), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request", ex.getMessage(), request);
    }
    
    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPartException(
            MissingServletRequestPartException ex,
            WebRequest request
    ) {
        log.warn("[API] Missing multipart part | part={} | contentType={}",
            ex.getRequestPartName(), request.getHeader("Content-Type"));
        String message = String.format(
            "Required part '%s' is not present. Send the bill as multipart/form-data with a file field named '%s'.",
            ex.getRequestPartName(), ex.getRequestPartName());
        return respond(HttpStatus.BAD_REQUEST, "File upload error", message, request);
    }
    
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex, WebRequest request) {
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, "File too large", ex.getMessage(), request);
    }
    
    @ExceptionHandler({QueryNotFoundException.class, BillNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex, WebRequest request) {
        return respond(HttpStatus.NOT_FOUND, "Not found", ex.getMessage(), request);
    }
    
    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(StorageException ex, WebRequest request) {
        log.error("[API] Storage unavailable | path={} | error={}", path(request), ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Storage unavailable", ex.getMessage(), request);
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, WebRequest request) {
        log.error("[API] Unexpected error | path={}", path(request), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex.getMessage(), request);
    }
    
    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, String error, WebRequest request) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .status(status.value())
            .timestamp(Instant.now())
            .path(path(request))
            .build();
        return ResponseEntity.status(status).body(body);
    }
    
    private static String path(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }
}
