package com.example.shorturl.exception;

public enum ValidationFailure {
    URL_TOO_LONG("URL too long"),
    INVALID_URL_FORMAT("invalid URL format"),
    UNSUPPORTED_SCHEME("only HTTP and HTTPS URLs are allowed"),
    DOMAIN_BLOCKED("domain is blocked"),
    CODE_LENGTH_OUT_OF_RANGE("short code must be between 4 and 20 characters"),
    CODE_NOT_ALPHANUMERIC("short code can only contain alphanumeric characters");

    private final String message;

    ValidationFailure(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
