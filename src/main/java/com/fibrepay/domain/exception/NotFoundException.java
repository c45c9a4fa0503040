package com.fibrepay.domain.exception;

public class NotFoundException extends PieceworkException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException of(String entity, String id) {
        return new NotFoundException(entity + " not found: " + id);
    }
}
