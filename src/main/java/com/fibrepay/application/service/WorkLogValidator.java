package com.fibrepay.application.service;

import com.fibrepay.application.port.in.WorkLoggingUseCase.AddTaskCommand;
import com.fibrepay.application.port.in.WorkLoggingUseCase.WorkDayCommand;
import com.fibrepay.application.port.in.WorkerAdministrationUseCase.CreateWorkerCommand;
import com.fibrepay.domain.model.Money;
import com.fibrepay.domain.model.PayoutFrequency;
import com.fibrepay.domain.model.WorkTaskPatch;
import com.fibrepay.domain.model.WorkerPatch;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates incoming work logging and worker administration commands
 */
public class WorkLogValidator {

    private static final int MAX_ID_LENGTH = 36;
    private static final int MAX_NAME_LENGTH = 200;
    private static final int MAX_NOTE_LENGTH = 500;
    private static final int QUANTITY_SCALE = 3;
    private static final BigDecimal MAX_QUANTITY = new BigDecimal("999999999.999");

    public ValidationResult validate(WorkDayCommand command) {
        List<String> errors = new ArrayList<>();

        if (isBlank(command.workerId())) {
            errors.add("workerId is required");
        }
        if (command.workDate() == null) {
            errors.add("workDate is required");
        }
        checkLength(command.workstationId(), MAX_ID_LENGTH, "workstationId", errors);
        checkLength(command.note(), MAX_NOTE_LENGTH, "note", errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(AddTaskCommand command) {
        List<String> errors = new ArrayList<>();

        if (isBlank(command.workDayId())) {
            errors.add("workDayId is required");
        }
        if (isBlank(command.taskTypeId())) {
            errors.add("taskTypeId is required");
        }
        if (command.quantity() == null) {
            errors.add("quantity is required");
        } else {
            checkQuantity(command.quantity(), errors);
        }
        // Client-generated ids let offline clients replay without duplicates
        if (command.taskId() != null && (command.taskId().isBlank() || command.taskId().length() > MAX_ID_LENGTH)) {
            errors.add("taskId must be 1 to " + MAX_ID_LENGTH + " characters");
        }
        checkLength(command.note(), MAX_NOTE_LENGTH, "note", errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(WorkTaskPatch patch) {
        List<String> errors = new ArrayList<>();

        if (patch.quantity() != null) {
            checkQuantity(patch.quantity(), errors);
        }
        if (patch.taskTypeId() != null && patch.taskTypeId().isBlank()) {
            errors.add("taskTypeId must not be blank");
        }
        checkLength(patch.note(), MAX_NOTE_LENGTH, "note", errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(CreateWorkerCommand command) {
        List<String> errors = new ArrayList<>();

        if (isBlank(command.fullName())) {
            errors.add("fullName is required");
        }
        checkLength(command.fullName(), MAX_NAME_LENGTH, "fullName", errors);
        checkLength(command.workerCode(), 50, "workerCode", errors);
        checkLength(command.factoryId(), MAX_ID_LENGTH, "factoryId", errors);

        if (command.payout() != null && !PayoutFrequency.isValid(command.payout())) {
            errors.add("payout must be one of weekly, biweekly, monthly");
        }

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(WorkerPatch patch) {
        List<String> errors = new ArrayList<>();

        if (patch.fullName() != null && patch.fullName().isBlank()) {
            errors.add("fullName must not be blank");
        }
        checkLength(patch.fullName(), MAX_NAME_LENGTH, "fullName", errors);
        checkLength(patch.workerCode(), 50, "workerCode", errors);
        checkLength(patch.factoryId(), MAX_ID_LENGTH, "factoryId", errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validateRate(BigDecimal rate) {
        List<String> errors = new ArrayList<>();

        if (rate == null) {
            errors.add("rate is required");
        } else {
            if (rate.signum() < 0) {
                errors.add("rate must be non-negative");
            }
            if (rate.stripTrailingZeros().scale() > Money.MINOR_UNIT_SCALE) {
                errors.add("rate must have at most " + Money.MINOR_UNIT_SCALE + " decimal places");
            }
        }

        return ValidationResult.of(errors);
    }

    private void checkQuantity(BigDecimal quantity, List<String> errors) {
        if (quantity.signum() < 0) {
            errors.add("quantity must be non-negative");
        }
        if (quantity.stripTrailingZeros().scale() > QUANTITY_SCALE) {
            errors.add("quantity must have at most " + QUANTITY_SCALE + " decimal places");
        }
        if (quantity.compareTo(MAX_QUANTITY) > 0) {
            errors.add("quantity is too large");
        }
    }

    private void checkLength(String value, int maxLength, String field, List<String> errors) {
        if (value != null && value.length() > maxLength) {
            errors.add(field + " must be at most " + maxLength + " characters");
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
