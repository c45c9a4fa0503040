package com.fibrepay.application.port.out;

import com.fibrepay.domain.model.SettlementPeriod;
import com.fibrepay.domain.model.TaskDecision;
import com.fibrepay.domain.model.WorkTask;
import com.fibrepay.domain.model.WorkTaskPatch;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Output port - work tasks, their decisions and their settlement claim
 */
public interface WorkTaskRepository {

    Future<Optional<WorkTask>> findById(String taskId, SqlConnection connection);

    /**
     * Read the task and hold a row lock until the transaction ends
     */
    Future<Optional<WorkTask>> findByIdForUpdate(String taskId, SqlConnection connection);

    Future<List<WorkTask>> findByWorkDay(String workDayId, SqlConnection connection);

    /**
     * Insert the task unless a task with the same id already exists
     * @return true when a row was inserted
     */
    Future<Boolean> insertIfAbsent(WorkTask task, SqlConnection connection);

    /**
     * Apply the non-null patch fields to a task that is still pending and unpaid
     * @return number of rows updated
     */
    Future<Integer> applyPatch(String taskId, WorkTaskPatch patch, String updatedBy, LocalDateTime updatedAt,
                               SqlConnection connection);

    /**
     * Delete a task that is still pending and unpaid
     * @return number of rows deleted
     */
    Future<Integer> deletePending(String taskId, SqlConnection connection);

    /**
     * Write a decision, conditioned on the task being unpaid and its day being open
     * @return number of rows updated, 0 when the condition no longer holds
     */
    Future<Integer> recordDecision(TaskDecision decision, SqlConnection connection);

    /**
     * Approved tasks with no paid run, on the worker's days inside the period
     * @param lock hold row locks on the returned tasks until the transaction ends
     */
    Future<List<WorkTask>> findApprovedUnpaid(String workerId, SettlementPeriod period, boolean lock,
                                              SqlConnection connection);

    /**
     * Compare-and-set claim: mark the tasks paid by the run where they are still
     * approved and unpaid
     * @return number of tasks claimed
     */
    Future<Integer> claimForRun(List<String> taskIds, String runId, LocalDateTime paidAt, SqlConnection connection);

    /**
     * Pending tasks across workers, newest day first
     * @param loggedBy restrict to days logged by this user, null for all
     */
    Future<List<PendingTask>> findPending(String workerId, LocalDate start, LocalDate end, String loggedBy,
                                          SqlConnection connection);

    /**
     * Pending task joined with its day, worker and task type for the approval queue
     */
    record PendingTask(
            String taskId,
            LocalDate workDate,
            String workerId,
            String workerName,
            String taskCode,
            String taskName,
            String unit,
            java.math.BigDecimal quantity,
            String note,
            LocalDateTime createdAt
    ) {}
}
