package com.kpisentinel.analyzer.controller;

import com.kpisentinel.analyzer.controller.dto.ErrorResponseDto;
import com.kpisentinel.analyzer.session.AnalysisNotFoundException;
import com.kpisentinel.analyzer.session.BaselineNotFoundException;
import com.kpisentinel.analyzer.session.SessionChangedException;
import com.kpisentinel.analyzer.session.SessionNotFoundException;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadable(HttpMessageNotReadableException ex) {
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be read",
                Map.of("reason", String.valueOf(ex.getMostSpecificCause().getMessage())));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponseDto> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return build(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "UNSUPPORTED_MEDIA_TYPE", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleSessionNotFound(SessionNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND", ex.getMessage(), Map.of("sessionId", ex.sessionId()));
    }

    @ExceptionHandler(BaselineNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleBaselineNotFound(BaselineNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "BASELINE_NOT_FOUND", ex.getMessage(), Map.of("metric", ex.metric()));
    }

    @ExceptionHandler(AnalysisNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleAnalysisNotFound(AnalysisNotFoundException ex) {
        return build(HttpStatus.CONFLICT, "NO_ANALYSIS", ex.getMessage(), Map.of("sessionId", ex.sessionId()));
    }

    @ExceptionHandler(SessionChangedException.class)
    public ResponseEntity<ErrorResponseDto> handleSessionChanged(SessionChangedException ex) {
        return build(HttpStatus.CONFLICT, "SESSION_CHANGED", ex.getMessage(), Map.of("sessionId", ex.sessionId()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatus status = HttpStatus.valueOf(errorResponse.getStatusCode().value());
            return build(status, "REQUEST_REJECTED", ex.getMessage(), Map.of());
        }
        log.error("Unhandled error", ex);
        Map<String, Object> details = new HashMap<>();
        details.put("reason", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", details);
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        return ResponseEntity.status(status)
                .body(ErrorResponseDto.forCurrentRequest(code, message, details));
    }
}
