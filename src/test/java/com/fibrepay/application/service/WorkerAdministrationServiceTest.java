package com.fibrepay.application.service;

import com.fibrepay.application.port.in.WorkerAdministrationUseCase.CreateWorkerCommand;
import com.fibrepay.domain.event.AuditActions;
import com.fibrepay.domain.exception.ForbiddenException;
import com.fibrepay.domain.exception.NotFoundException;
import com.fibrepay.domain.exception.ValidationException;
import com.fibrepay.domain.model.PayoutFrequency;
import com.fibrepay.domain.model.TaskCategory;
import com.fibrepay.domain.model.TaskType;
import com.fibrepay.domain.model.Worker;
import com.fibrepay.domain.model.WorkerPatch;
import com.fibrepay.domain.model.WorkerRate;
import com.fibrepay.support.PieceworkFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.fibrepay.support.PieceworkFixture.*;
import static com.fibrepay.support.TestDatabase.await;
import static com.fibrepay.support.TestDatabase.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Worker administration against an in-memory H2 database
 */
class WorkerAdministrationServiceTest {

    private PieceworkFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new PieceworkFixture();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void createWorker_defaultsToWeeklyFromToday() {
        // When
        Worker worker = await(fixture.workerAdministration.createWorker(
                new CreateWorkerCommand("B-17", "  Amina Diallo ", "factory-a", null, null), SUPERVISOR));

        // Then
        assertEquals("Amina Diallo", worker.getFullName());
        assertEquals(PayoutFrequency.WEEKLY, worker.getPayout());
        assertEquals(LocalDate.of(2024, 3, 15), worker.getPayoutAnchorDate());
        assertTrue(worker.isActive());
        assertTrue(fixture.audit.actions().contains(AuditActions.WORKER_CREATE));

        List<Worker> stored = await(fixture.workerAdministration.listWorkers(false));
        assertEquals(1, stored.size());
        assertEquals("B-17", stored.get(0).getWorkerCode());
        assertEquals("factory-a", stored.get(0).getFactoryId());
    }

    @Test
    void createWorker_rejectsUnknownPayout() {
        Throwable error = awaitFailure(fixture.workerAdministration.createWorker(
                new CreateWorkerCommand(null, "Amina Diallo", null, "daily", null), ADMIN));

        assertInstanceOf(ValidationException.class, error);
    }

    @Test
    void updateWorker_adminDeactivates() {
        // Given
        Worker worker = fixture.worker("Amina Diallo", "weekly", LocalDate.of(2024, 3, 4));

        // When
        await(fixture.workerAdministration.updateWorker(worker.getId(),
                WorkerPatch.builder().active(false).payout(PayoutFrequency.MONTHLY).build(), ADMIN));

        // Then
        assertTrue(await(fixture.workerAdministration.listWorkers(false)).isEmpty());
        Worker updated = await(fixture.workerAdministration.listWorkers(true)).get(0);
        assertFalse(updated.isActive());
        assertEquals(PayoutFrequency.MONTHLY, updated.getPayout());
    }

    @Test
    void updateWorker_requiresAdminAndExistingWorker() {
        Worker worker = fixture.worker("Amina Diallo", "weekly", LocalDate.of(2024, 3, 4));

        assertInstanceOf(ForbiddenException.class, awaitFailure(fixture.workerAdministration.updateWorker(
                worker.getId(), WorkerPatch.builder().fullName("Renamed").build(), SUPERVISOR)));
        assertInstanceOf(NotFoundException.class, awaitFailure(fixture.workerAdministration.updateWorker(
                "no-such-worker", WorkerPatch.builder().fullName("Renamed").build(), ADMIN)));
    }

    @Test
    void listTaskTypes_returnsSeededTypes() {
        Map<String, TaskType> byId = await(fixture.workerAdministration.listTaskTypes()).stream()
                .collect(Collectors.toMap(TaskType::getId, type -> type));

        assertEquals(TaskCategory.COMBING, byId.get(COMBING).getCategory());
        assertEquals(0, new BigDecimal("150.00").compareTo(byId.get(COMBING).getDefaultRate()));
        assertEquals(TaskCategory.WEAVING, byId.get(WEAVING).getCategory());
        assertEquals(TaskCategory.WEAVING, byId.get(TWISTING).getCategory());
        assertEquals(0, new BigDecimal("4.00").compareTo(byId.get(TWISTING).getDefaultRate()));
    }

    @Test
    void upsertRate_replacesExistingOverride() {
        // Given
        Worker worker = fixture.worker("Amina Diallo", "weekly", LocalDate.of(2024, 3, 4));
        String first = await(fixture.workerAdministration.upsertRate(worker.getId(), WEAVING, new BigDecimal("6.00"), ADMIN));

        // When
        String second = await(fixture.workerAdministration.upsertRate(worker.getId(), WEAVING, new BigDecimal("6.50"), ADMIN));

        // Then
        assertEquals(first, second);
        List<WorkerRate> rates = await(fixture.workerAdministration.listRates(worker.getId()));
        assertEquals(1, rates.size());
        assertEquals(0, new BigDecimal("6.50").compareTo(rates.get(0).getRate()));
    }

    @Test
    void upsertRate_rejectsBadInput() {
        Worker worker = fixture.worker("Amina Diallo", "weekly", LocalDate.of(2024, 3, 4));

        assertInstanceOf(ForbiddenException.class, awaitFailure(fixture.workerAdministration.upsertRate(
                worker.getId(), WEAVING, BigDecimal.ONE, SUPERVISOR)));
        assertInstanceOf(ValidationException.class, awaitFailure(fixture.workerAdministration.upsertRate(
                worker.getId(), WEAVING, new BigDecimal("-1"), ADMIN)));
        assertInstanceOf(NotFoundException.class, awaitFailure(fixture.workerAdministration.upsertRate(
                worker.getId(), "tt-spinning", BigDecimal.ONE, ADMIN)));
        assertInstanceOf(NotFoundException.class, awaitFailure(fixture.workerAdministration.upsertRate(
                "no-such-worker", WEAVING, BigDecimal.ONE, ADMIN)));
    }

    @Test
    void deleteRate_removesOverride() {
        // Given
        Worker worker = fixture.worker("Amina Diallo", "weekly", LocalDate.of(2024, 3, 4));
        String rateId = await(fixture.workerAdministration.upsertRate(worker.getId(), COMBING, new BigDecimal("90.00"), ADMIN));

        // When
        await(fixture.workerAdministration.deleteRate(rateId, ADMIN));

        // Then
        assertTrue(await(fixture.workerAdministration.listRates(worker.getId())).isEmpty());
        assertInstanceOf(NotFoundException.class, awaitFailure(fixture.workerAdministration.deleteRate(rateId, ADMIN)));
        assertTrue(fixture.audit.actions().contains(AuditActions.WORKER_RATE_DELETE));
    }
}
