package com.example.contextrag.controller.exception;

import org.springframework.http.HttpStatus;

/**
 * Request-level failure with a known HTTP status.
 */
public class BusinessException extends RuntimeException {

    private final HttpStatus status;

    public BusinessException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
