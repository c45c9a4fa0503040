package com.fibrepay.domain.exception;

/**
 * An insert lost a race on a unique key to a concurrent writer of the same entry
 */
public class DuplicateEntryException extends ConflictException {

    public DuplicateEntryException(String message) {
        super(message);
    }
}
