package com.fibrepay.application.service;

import com.fibrepay.application.port.in.ApprovalUseCase;
import com.fibrepay.application.port.out.WorkDayRepository;
import com.fibrepay.application.port.out.WorkTaskRepository;
import com.fibrepay.application.port.out.WorkTaskRepository.PendingTask;
import com.fibrepay.domain.event.AuditActions;
import com.fibrepay.domain.exception.ConflictException;
import com.fibrepay.domain.exception.NotFoundException;
import com.fibrepay.domain.exception.ValidationException;
import com.fibrepay.domain.model.Actor;
import com.fibrepay.domain.model.Money;
import com.fibrepay.domain.model.TaskDecision;
import com.fibrepay.domain.model.TaskStatus;
import com.fibrepay.domain.model.WorkDay;
import com.fibrepay.domain.model.WorkTask;
import io.vertx.core.Future;
import io.vertx.jdbcclient.JDBCPool;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Use case implementation for the approval workflow.
 * A decision settles the task's pay at the rate in force at decision time;
 * the pay is written with the status and never recomputed afterwards.
 */
public class ApprovalService implements ApprovalUseCase {
    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    private final JDBCPool jdbcPool;
    private final WorkTaskRepository workTaskRepository;
    private final WorkDayRepository workDayRepository;
    private final RateResolver rateResolver;
    private final AuthorizationPolicy authorizationPolicy;
    private final AuditTrail auditTrail;
    private final Clock clock;

    public ApprovalService(
            JDBCPool jdbcPool,
            WorkTaskRepository workTaskRepository,
            WorkDayRepository workDayRepository,
            RateResolver rateResolver,
            AuthorizationPolicy authorizationPolicy,
            AuditTrail auditTrail,
            Clock clock
    ) {
        this.jdbcPool = jdbcPool;
        this.workTaskRepository = workTaskRepository;
        this.workDayRepository = workDayRepository;
        this.rateResolver = rateResolver;
        this.authorizationPolicy = authorizationPolicy;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    @Override
    public Future<BigDecimal> decide(DecisionCommand command) {
        log.info("Decide task {} -> {} by {}", command.taskId(), command.status(), command.decider().userId());

        if (command.status() == null || !command.status().isDecision()) {
            return Future.failedFuture(new ValidationException("status must be approved or rejected"));
        }

        return jdbcPool.withTransaction(connection ->
                        applyDecision(connection, command.taskId(), command.status(), command.reason(),
                                command.decider(), false))
                .onSuccess(decision -> audit(command.decider(), decision))
                .onFailure(error -> log.warn("Decision on task {} failed: {}", command.taskId(), error.getMessage()))
                .map(TaskDecision::approvedPay);
    }

    @Override
    public Future<Integer> bulkDecide(BulkDecisionCommand command) {
        if (command.status() == null || !command.status().isDecision()) {
            return Future.failedFuture(new ValidationException("status must be approved or rejected"));
        }
        if (command.taskIds() == null || command.taskIds().isEmpty()) {
            return Future.succeededFuture(0);
        }

        log.info("Bulk decide {} tasks -> {} by {}", command.taskIds().size(), command.status(),
                command.decider().userId());

        // Each task is decided in its own transaction; a failing task is skipped
        Future<Integer> chain = Future.succeededFuture(0);
        for (String taskId : new LinkedHashSet<>(command.taskIds())) {
            chain = chain.compose(updated -> jdbcPool.withTransaction(connection ->
                            applyDecision(connection, taskId, command.status(), command.reason(),
                                    command.decider(), true))
                    .onSuccess(decision -> audit(command.decider(), decision))
                    .map(decision -> updated + 1)
                    .recover(error -> {
                        log.warn("Skipping task {} in bulk decision: {}", taskId, error.getMessage());
                        return Future.succeededFuture(updated);
                    }));
        }

        return chain.onSuccess(updated -> log.info("Bulk decision updated {} of {} tasks",
                updated, command.taskIds().size()));
    }

    @Override
    public Future<List<PendingTask>> pendingApprovals(PendingFilter filter, Actor actor) {
        String loggedBy = authorizationPolicy.loggedByScope(actor);
        return jdbcPool.withConnection(connection ->
                workTaskRepository.findPending(filter.workerId(), filter.start(), filter.end(), loggedBy, connection));
    }

    /**
     * Lock the task, check its day and payment state, settle pay and write the decision
     */
    private Future<TaskDecision> applyDecision(
            SqlConnection connection,
            String taskId,
            TaskStatus status,
            String reason,
            Actor decider,
            boolean checkAuthorization
    ) {
        // Step 1: Lock the task row
        return workTaskRepository.findByIdForUpdate(taskId, connection)
                .compose(found -> Required.present(found, () -> NotFoundException.of("Task", taskId)))
                .compose(task -> workDayRepository.findById(task.getWorkDayId(), connection)
                        .compose(found -> Required.present(found, () -> NotFoundException.of("Work day", task.getWorkDayId())))
                        .compose(workDay -> {
                            // Step 2: Closed days and paid tasks are frozen
                            if (workDay.isClosed()) {
                                return Future.failedFuture(new ConflictException(
                                        "Work day " + workDay.getId() + " is closed"));
                            }
                            if (task.isPaid()) {
                                return Future.failedFuture(new ConflictException(
                                        "Task " + taskId + " was already paid by run " + task.getPaidRunId()));
                            }
                            if (checkAuthorization) {
                                authorizationPolicy.requireDayAccess(decider, workDay);
                            }

                            // Step 3: Settle pay and write the decision
                            return settlePay(task, workDay, status, connection)
                                    .compose(pay -> writeDecision(connection, new TaskDecision(
                                            taskId,
                                            status,
                                            decider.userId(),
                                            LocalDateTime.now(clock),
                                            reason,
                                            pay
                                    )));
                        }));
    }

    private Future<BigDecimal> settlePay(WorkTask task, WorkDay workDay, TaskStatus status, SqlConnection connection) {
        if (status != TaskStatus.APPROVED) {
            return Future.succeededFuture(Money.ZERO);
        }
        return rateResolver.resolve(workDay.getWorkerId(), task.getTaskTypeId(), connection)
                .map(rate -> Money.settledPay(task.getQuantity(), rate));
    }

    // The write re-checks the lock conditions so a concurrent close or claim wins
    private Future<TaskDecision> writeDecision(SqlConnection connection, TaskDecision decision) {
        return workTaskRepository.recordDecision(decision, connection)
                .compose(updated -> {
                    if (updated == 0) {
                        return Future.failedFuture(new ConflictException(
                                "Task " + decision.taskId() + " was closed or paid concurrently"));
                    }
                    log.debug("Task {} {} with pay {}", decision.taskId(), decision.status().getValue(),
                            decision.approvedPay());
                    return Future.succeededFuture(decision);
                });
    }

    private void audit(Actor decider, TaskDecision decision) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("status", decision.status().getValue());
        metadata.put("reason", decision.reason());
        metadata.put("approvedPay", decision.approvedPay().toPlainString());

        String action = decision.status() == TaskStatus.APPROVED ? AuditActions.TASK_APPROVE : AuditActions.TASK_REJECT;
        auditTrail.record(decider, action, AuditActions.ENTITY_WORK_TASK, decision.taskId(), metadata);
    }
}
