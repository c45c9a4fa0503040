package com.fibrepay.application.service;

import com.fibrepay.application.port.in.ApprovalUseCase.BulkDecisionCommand;
import com.fibrepay.application.port.in.ApprovalUseCase.DecisionCommand;
import com.fibrepay.application.port.in.ApprovalUseCase.PendingFilter;
import com.fibrepay.application.port.in.PayrollRunUseCase.CreateRunCommand;
import com.fibrepay.application.port.out.WorkTaskRepository.PendingTask;
import com.fibrepay.domain.event.AuditActions;
import com.fibrepay.domain.exception.ConflictException;
import com.fibrepay.domain.exception.NotFoundException;
import com.fibrepay.domain.exception.ValidationException;
import com.fibrepay.domain.model.TaskStatus;
import com.fibrepay.domain.model.WorkTask;
import com.fibrepay.domain.model.Worker;
import com.fibrepay.support.PieceworkFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.fibrepay.support.PieceworkFixture.*;
import static com.fibrepay.support.TestDatabase.await;
import static com.fibrepay.support.TestDatabase.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Approval workflow against an in-memory H2 database
 */
class ApprovalServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 3, 4);
    private static final LocalDate TUESDAY = LocalDate.of(2024, 3, 5);

    private PieceworkFixture fixture;
    private Worker worker;
    private String dayId;

    @BeforeEach
    void setUp() {
        fixture = new PieceworkFixture();
        worker = fixture.worker("Amina Diallo", "weekly", MONDAY);
        dayId = fixture.day(worker.getId(), TUESDAY);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void decide_approveSettlesPayAtDefaultRate() {
        // Given
        String taskId = fixture.task(dayId, COMBING, "2.000");

        // When
        BigDecimal pay = fixture.approve(taskId);

        // Then
        assertEquals(new BigDecimal("300.00"), pay);
        WorkTask task = fixture.load(taskId);
        assertEquals(TaskStatus.APPROVED, task.getStatus());
        assertEquals(0, new BigDecimal("300.00").compareTo(task.getApprovedPay()));
        assertEquals(ADMIN.userId(), task.getDecidedBy());
        assertNotNull(task.getDecidedAt());
        assertTrue(fixture.audit.actions().contains(AuditActions.TASK_APPROVE));
    }

    @Test
    void decide_workerOverrideWinsAndRoundsHalfUp() {
        // Given
        await(fixture.workerAdministration.upsertRate(worker.getId(), COMBING, new BigDecimal("100.00"), ADMIN));
        String taskId = fixture.task(dayId, COMBING, "3.335");

        // When
        BigDecimal pay = fixture.approve(taskId);

        // Then
        assertEquals(new BigDecimal("333.50"), pay);
    }

    @Test
    void decide_rejectStoresZeroPay() {
        // Given
        String taskId = fixture.task(dayId, WEAVING, "30");

        // When
        BigDecimal pay = await(fixture.approvals.decide(
                new DecisionCommand(taskId, TaskStatus.REJECTED, "short count", SUPERVISOR)));

        // Then
        assertEquals(0, BigDecimal.ZERO.compareTo(pay));
        WorkTask task = fixture.load(taskId);
        assertEquals(TaskStatus.REJECTED, task.getStatus());
        assertEquals("short count", task.getDecisionReason());
        assertEquals(0, BigDecimal.ZERO.compareTo(task.getApprovedPay()));
        assertTrue(fixture.audit.actions().contains(AuditActions.TASK_REJECT));
    }

    @Test
    void decide_reDecidingGivesSamePay() {
        // Given
        String taskId = fixture.task(dayId, WEAVING, "30");

        // When
        BigDecimal first = fixture.approve(taskId);
        await(fixture.approvals.decide(new DecisionCommand(taskId, TaskStatus.REJECTED, null, ADMIN)));
        BigDecimal second = fixture.approve(taskId);

        // Then
        assertEquals(new BigDecimal("150.00"), first);
        assertEquals(first, second);
    }

    @Test
    void decide_storedPayIgnoresLaterRateChanges() {
        // Given
        String taskId = fixture.task(dayId, COMBING, "1");
        fixture.approve(taskId);

        // When
        await(fixture.workerAdministration.upsertRate(worker.getId(), COMBING, new BigDecimal("999.00"), ADMIN));

        // Then
        assertEquals(0, new BigDecimal("150.00").compareTo(fixture.load(taskId).getApprovedPay()));
    }

    @Test
    void decide_closedDayIsConflict() {
        // Given
        String taskId = fixture.task(dayId, COMBING, "1");
        await(fixture.workLogging.closeDay(dayId, SUPERVISOR));

        // When
        Throwable error = awaitFailure(fixture.approvals.decide(
                new DecisionCommand(taskId, TaskStatus.APPROVED, null, ADMIN)));

        // Then
        assertInstanceOf(ConflictException.class, error);
        assertEquals(TaskStatus.PENDING, fixture.load(taskId).getStatus());
    }

    @Test
    void decide_paidTaskIsConflict() {
        // Given
        String taskId = fixture.task(dayId, COMBING, "1");
        fixture.approve(taskId);
        await(fixture.payrollRuns.createRun(new CreateRunCommand(LocalDate.of(2024, 3, 10), null, ADMIN)));

        // When
        Throwable error = awaitFailure(fixture.approvals.decide(
                new DecisionCommand(taskId, TaskStatus.REJECTED, "late", ADMIN)));

        // Then
        assertInstanceOf(ConflictException.class, error);
        WorkTask task = fixture.load(taskId);
        assertEquals(TaskStatus.APPROVED, task.getStatus());
        assertNotNull(task.getPaidRunId());
    }

    @Test
    void decide_reapprovingPaidTaskIsConflictAndKeepsPay() {
        // Given
        String taskId = fixture.task(dayId, COMBING, "1");
        fixture.approve(taskId);
        String runId = await(fixture.payrollRuns.createRun(new CreateRunCommand(LocalDate.of(2024, 3, 10), null, ADMIN)));
        await(fixture.workerAdministration.upsertRate(worker.getId(), COMBING, new BigDecimal("200.00"), ADMIN));

        // When
        Throwable error = awaitFailure(fixture.approvals.decide(
                new DecisionCommand(taskId, TaskStatus.APPROVED, "again", ADMIN)));

        // Then
        assertInstanceOf(ConflictException.class, error);
        WorkTask task = fixture.load(taskId);
        assertEquals(TaskStatus.APPROVED, task.getStatus());
        assertEquals(0, new BigDecimal("150.00").compareTo(task.getApprovedPay()));
        assertEquals(runId, task.getPaidRunId());
    }

    @Test
    void decide_unknownTaskIsNotFound() {
        Throwable error = awaitFailure(fixture.approvals.decide(
                new DecisionCommand("no-such-task", TaskStatus.APPROVED, null, ADMIN)));

        assertInstanceOf(NotFoundException.class, error);
    }

    @Test
    void decide_pendingIsNotADecision() {
        String taskId = fixture.task(dayId, COMBING, "1");

        Throwable error = awaitFailure(fixture.approvals.decide(
                new DecisionCommand(taskId, TaskStatus.PENDING, null, ADMIN)));

        assertInstanceOf(ValidationException.class, error);
    }

    @Test
    void bulkDecide_skipsTasksThatCannotBeDecided() {
        // Given
        String open1 = fixture.task(dayId, COMBING, "1");
        String open2 = fixture.task(dayId, WEAVING, "60");

        String closedDayId = fixture.day(worker.getId(), MONDAY);
        String onClosedDay = fixture.task(closedDayId, COMBING, "1");
        await(fixture.workLogging.closeDay(closedDayId, ADMIN));

        // When
        int updated = await(fixture.approvals.bulkDecide(new BulkDecisionCommand(
                List.of(open1, onClosedDay, "no-such-task", open2, open1), TaskStatus.APPROVED, null, ADMIN)));

        // Then
        assertEquals(2, updated);
        assertEquals(TaskStatus.APPROVED, fixture.load(open1).getStatus());
        assertEquals(TaskStatus.APPROVED, fixture.load(open2).getStatus());
        assertEquals(TaskStatus.PENDING, fixture.load(onClosedDay).getStatus());
    }

    @Test
    void bulkDecide_supervisorOnlyDecidesDaysTheyLogged() {
        // Given
        String own = fixture.task(dayId, COMBING, "1");
        String othersDayId = fixture.day(worker.getId(), LocalDate.of(2024, 3, 6), OTHER_SUPERVISOR);
        String others = fixture.task(othersDayId, COMBING, "1");

        // When
        int updated = await(fixture.approvals.bulkDecide(new BulkDecisionCommand(
                List.of(own, others), TaskStatus.REJECTED, "recount", SUPERVISOR)));

        // Then
        assertEquals(1, updated);
        assertEquals(TaskStatus.REJECTED, fixture.load(own).getStatus());
        assertEquals(TaskStatus.PENDING, fixture.load(others).getStatus());
    }

    @Test
    void bulkDecide_emptyListUpdatesNothing() {
        assertEquals(0, await(fixture.approvals.bulkDecide(
                new BulkDecisionCommand(List.of(), TaskStatus.APPROVED, null, ADMIN))));
    }

    @Test
    void pendingApprovals_areScopedToTheSupervisor() {
        // Given
        String own = fixture.task(dayId, COMBING, "1");
        String othersDayId = fixture.day(worker.getId(), LocalDate.of(2024, 3, 6), OTHER_SUPERVISOR);
        String others = fixture.task(othersDayId, WEAVING, "12");
        fixture.approve(fixture.task(dayId, WEAVING, "5"));

        // When
        List<PendingTask> forSupervisor = await(fixture.approvals.pendingApprovals(
                new PendingFilter(null, null, null), SUPERVISOR));
        List<PendingTask> forAdmin = await(fixture.approvals.pendingApprovals(
                new PendingFilter(worker.getId(), MONDAY, LocalDate.of(2024, 3, 10)), ADMIN));

        // Then
        assertEquals(List.of(own), forSupervisor.stream().map(PendingTask::taskId).toList());
        assertEquals(2, forAdmin.size());
        // Newest day first
        assertEquals(others, forAdmin.get(0).taskId());
        assertEquals("Amina Diallo", forAdmin.get(0).workerName());
    }
}
