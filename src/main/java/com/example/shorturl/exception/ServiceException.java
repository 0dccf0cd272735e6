package com.example.shorturl.exception;

/**
 * The single failure type raised by the service and store layers. Callers branch on {@link #getKind()}.
 */
public class ServiceException extends RuntimeException {

    private final ErrorKind kind;
    private final String op;
    private final String detail;
    private final ValidationFailure reason;

    private ServiceException(ErrorKind kind, String op, String detail, ValidationFailure reason, Throwable cause) {
        super(cause != null ? op + ": " + detail + ": " + cause.getMessage() : op + ": " + detail, cause);
        this.kind = kind;
        this.op = op;
        this.detail = detail;
        this.reason = reason;
    }

    public static ServiceException validation(String op, ValidationFailure reason) {
        return validation(op, reason, null);
    }

    public static ServiceException validation(String op, ValidationFailure reason, Throwable cause) {
        return new ServiceException(ErrorKind.VALIDATION, op, reason.getMessage(), reason, cause);
    }

    public static ServiceException duplicate(String op, String message) {
        return new ServiceException(ErrorKind.DUPLICATE, op, message, null, null);
    }

    public static ServiceException notFound(String op, String message) {
        return new ServiceException(ErrorKind.NOT_FOUND, op, message, null, null);
    }

    public static ServiceException internal(String op, String message, Throwable cause) {
        return new ServiceException(ErrorKind.INTERNAL, op, message, null, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getOp() {
        return op;
    }

    public String getDetail() {
        return detail;
    }

    public ValidationFailure getReason() {
        return reason;
    }
}
