package com.fibrepay.domain.exception;

import lombok.Getter;

/**
 * Base class for business failures. Never retried inside the core.
 */
@Getter
public abstract class PieceworkException extends RuntimeException {

    private final ErrorCode errorCode;

    protected PieceworkException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
