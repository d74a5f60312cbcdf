package com.odin.call_signaling_service.exception;

import org.apache.commons.lang.exception.ExceptionUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import com.odin.call_signaling_service.dto.ErrorResponse;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(CallServiceException.class)
    public ResponseEntity<ErrorResponse> handleCallServiceException(CallServiceException ex) {
        ErrorCode code = ex.getErrorCode();
        if (ex.isConflict()) {
            log.warn("Conflict: {} - {}", code.getReason(), ex.getMessage());
        } else {
            log.info("Rejected: {} - {}", code.getReason(), ex.getMessage());
        }
        return body(code.getHttpStatus(), code.getReason(), ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        String error = status == HttpStatus.UNAUTHORIZED ? ErrorCode.UNAUTHORIZED.getReason()
                : status.name().toLowerCase();
        return body(status, error, ex.getReason());
    }

    @ExceptionHandler({ MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        log.info("Malformed request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR.getReason(), "Malformed request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled exception: {}", ExceptionUtils.getStackTrace(ex));
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred");
    }

    private ResponseEntity<ErrorResponse> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), error, message));
    }
}
