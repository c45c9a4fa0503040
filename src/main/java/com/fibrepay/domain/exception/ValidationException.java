package com.fibrepay.domain.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class ValidationException extends PieceworkException {

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        super(ErrorCode.VALIDATION, "Validation failed: " + errors);
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String error) {
        this(List.of(error));
    }
}
