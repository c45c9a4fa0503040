package com.fibrepay.domain.exception;

/**
 * The target is in a state that forbids the change: closed day, paid task,
 * or a settlement claim lost to a concurrent run.
 */
public class ConflictException extends PieceworkException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
