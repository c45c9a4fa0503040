package com.fibrepay.application.service;

import com.fibrepay.application.port.in.WorkLoggingUseCase.AddTaskCommand;
import com.fibrepay.application.port.in.WorkLoggingUseCase.WorkDayCommand;
import com.fibrepay.application.port.in.WorkerAdministrationUseCase.CreateWorkerCommand;
import com.fibrepay.domain.exception.ValidationException;
import com.fibrepay.domain.model.WorkTaskPatch;
import com.fibrepay.domain.model.WorkerPatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WorkLogValidator
 */
class WorkLogValidatorTest {

    private WorkLogValidator validator;

    @BeforeEach
    void setUp() {
        validator = new WorkLogValidator();
    }

    @Test
    void testValidWorkDay() {
        WorkDayCommand command = new WorkDayCommand("w-1", LocalDate.of(2024, 3, 5), "loom-4", "morning shift");

        ValidationResult result = validator.validate(command);

        assertTrue(result.isValid(), "Expected valid, but got errors: " + result.errors());
    }

    @Test
    void testWorkDayMissingFields() {
        ValidationResult result = validator.validate(new WorkDayCommand(" ", null, null, null));

        assertFalse(result.isValid());
        assertTrue(result.errors().contains("workerId is required"));
        assertTrue(result.errors().contains("workDate is required"));
    }

    @Test
    void testValidTask() {
        AddTaskCommand command = new AddTaskCommand("client-id-1", "d-1", "tt-combing", new BigDecimal("3.335"), null);

        assertTrue(validator.validate(command).isValid());
    }

    @Test
    void testTaskQuantityRules() {
        assertFalse(validator.validate(task(new BigDecimal("-1"))).isValid());
        assertFalse(validator.validate(task(new BigDecimal("1.2345"))).isValid());
        assertFalse(validator.validate(task(new BigDecimal("1000000000"))).isValid());
        assertFalse(validator.validate(task(null)).isValid());

        assertTrue(validator.validate(task(BigDecimal.ZERO)).isValid());
        assertTrue(validator.validate(task(new BigDecimal("1.2300"))).isValid());
    }

    @Test
    void testTaskIdLength() {
        AddTaskCommand tooLong = new AddTaskCommand("x".repeat(37), "d-1", "tt-weaving", BigDecimal.ONE, null);
        AddTaskCommand blank = new AddTaskCommand(" ", "d-1", "tt-weaving", BigDecimal.ONE, null);

        assertFalse(validator.validate(tooLong).isValid());
        assertFalse(validator.validate(blank).isValid());
    }

    @Test
    void testTaskPatch() {
        assertTrue(validator.validate(WorkTaskPatch.builder().note("fixed").build()).isValid());
        assertFalse(validator.validate(WorkTaskPatch.builder().quantity(new BigDecimal("-0.5")).build()).isValid());
        assertFalse(validator.validate(WorkTaskPatch.builder().taskTypeId("").build()).isValid());
        assertFalse(validator.validate(WorkTaskPatch.builder().note("n".repeat(501)).build()).isValid());
    }

    @Test
    void testCreateWorker() {
        assertTrue(validator.validate(new CreateWorkerCommand(null, "Amina Diallo", null, "biweekly", null)).isValid());

        ValidationResult result = validator.validate(new CreateWorkerCommand(null, "", null, "daily", null));
        assertFalse(result.isValid());
        assertEquals(2, result.errors().size());
    }

    @Test
    void testWorkerPatch() {
        assertTrue(validator.validate(WorkerPatch.builder().active(false).build()).isValid());
        assertFalse(validator.validate(WorkerPatch.builder().fullName("  ").build()).isValid());
    }

    @Test
    void testRate() {
        assertTrue(validator.validateRate(new BigDecimal("12.50")).isValid());
        assertTrue(validator.validateRate(BigDecimal.ZERO).isValid());
        assertFalse(validator.validateRate(new BigDecimal("-1.00")).isValid());
        assertFalse(validator.validateRate(new BigDecimal("1.005")).isValid());
        assertFalse(validator.validateRate(null).isValid());
    }

    @Test
    void testThrowIfInvalid() {
        ValidationResult invalid = validator.validateRate(null);

        ValidationException error = assertThrows(ValidationException.class, invalid::throwIfInvalid);
        assertEquals(1, error.getErrors().size());
        assertDoesNotThrow(() -> validator.validateRate(BigDecimal.ONE).throwIfInvalid());
    }

    private static AddTaskCommand task(BigDecimal quantity) {
        return new AddTaskCommand(null, "d-1", "tt-combing", quantity, null);
    }
}
