package com.fibrepay.domain.exception;

/**
 * Failure categories reported to callers, with the HTTP status the web adapter uses
 */
public enum ErrorCode {
    NOT_FOUND(404),
    CONFLICT(409),
    VALIDATION(400),
    FORBIDDEN(403);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
