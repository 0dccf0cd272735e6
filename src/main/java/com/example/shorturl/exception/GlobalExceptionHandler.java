package com.example.shorturl.exception;

import com.example.shorturl.dto.ApiErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps {@link ServiceException} kinds to HTTP statuses. Internal failures are reported with a generic
 * message; their cause only goes to the log.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ServiceException.class)
    public ResponseEntity<ApiErrorResponse> handleServiceException(ServiceException ex) {
        HttpStatus status = statusOf(ex.getKind());

        if (status == HttpStatus.INTERNAL_SERVER_ERROR) {
            log.error("Service error in {}", ex.getOp(), ex);
            return body(status, "Internal server error", "An unexpected error occurred");
        }

        log.warn("Service error: status={} {}", status.value(), ex.getMessage());
        return body(status, ex.getDetail(), ex.getDetail());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiErrorResponse> handleBadPayload(Exception ex) {
        log.warn("Invalid request payload: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Invalid request payload", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse) {
            // framework errors such as unknown routes or unsupported methods keep their own status
            ErrorResponse frameworkError = (ErrorResponse) ex;
            HttpStatus status = HttpStatus.valueOf(frameworkError.getStatusCode().value());
            return body(status, status.getReasonPhrase(), ex.getMessage());
        }
        log.error("Unhandled exception", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "An unexpected error occurred");
    }

    private static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case DUPLICATE:
                return HttpStatus.CONFLICT;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<ApiErrorResponse> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(new ApiErrorResponse(error, message, status.value()));
    }
}
