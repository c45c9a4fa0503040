package com.fibrepay.application.service;

import com.fibrepay.domain.exception.ValidationException;

import java.util.Collections;
import java.util.List;

/**
 * Result of validating a command
 */
public record ValidationResult(boolean isValid, List<String> errors) {

    public static ValidationResult of(List<String> errors) {
        if (errors.isEmpty()) {
            return new ValidationResult(true, Collections.emptyList());
        }
        return new ValidationResult(false, Collections.unmodifiableList(errors));
    }

    /**
     * @throws ValidationException carrying every error when invalid
     */
    public void throwIfInvalid() {
        if (!isValid) {
            throw new ValidationException(errors);
        }
    }
}
