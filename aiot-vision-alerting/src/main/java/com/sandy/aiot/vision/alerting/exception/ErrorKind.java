package com.sandy.aiot.vision.alerting.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error kinds reported by every alerting API.
 */
public enum ErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_TRANSITION(HttpStatus.BAD_REQUEST),
    INVALID_SCHEDULE(HttpStatus.UNPROCESSABLE_ENTITY),
    CONFLICT(HttpStatus.CONFLICT),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
