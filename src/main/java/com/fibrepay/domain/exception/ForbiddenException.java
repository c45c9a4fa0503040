package com.fibrepay.domain.exception;

public class ForbiddenException extends PieceworkException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
