package com.example.shorturl.exception;

public enum ErrorKind {
    VALIDATION,
    DUPLICATE,
    NOT_FOUND,
    INTERNAL
}
