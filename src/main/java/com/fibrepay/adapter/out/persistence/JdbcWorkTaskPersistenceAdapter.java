package com.fibrepay.adapter.out.persistence;

import com.fibrepay.application.port.out.WorkTaskRepository;
import com.fibrepay.domain.exception.DuplicateEntryException;
import com.fibrepay.domain.model.SettlementPeriod;
import com.fibrepay.domain.model.TaskDecision;
import com.fibrepay.domain.model.TaskStatus;
import com.fibrepay.domain.model.WorkTask;
import com.fibrepay.domain.model.WorkTaskPatch;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of WorkTaskRepository.
 *
 * Every write that must not touch a closed day or a paid task re-checks those
 * conditions in its WHERE clause, so callers learn from the row count whether
 * the write still applied.
 */
@Slf4j
public class JdbcWorkTaskPersistenceAdapter implements WorkTaskRepository {

    private static final String COLUMNS = "ID, WORK_DAY_ID, TASK_TYPE_ID, QUANTITY, NOTE, STATUS, DECIDED_BY, "
            + "DECIDED_AT, DECISION_REASON, APPROVED_PAY, PAID_RUN_ID, PAID_AT, UPDATED_BY, UPDATED_AT, CREATED_AT";

    @Override
    public Future<Optional<WorkTask>> findById(String taskId, SqlConnection connection) {
        String sql = "SELECT " + COLUMNS + " FROM WORK_TASK WHERE ID = ?";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(taskId))
                .map(rows -> SqlSupport.first(rows, this::mapRow))
                .onFailure(error -> log.error("Failed to find task {}: {}", taskId, error.getMessage()));
    }

    @Override
    public Future<Optional<WorkTask>> findByIdForUpdate(String taskId, SqlConnection connection) {
        String sql = "SELECT " + COLUMNS + " FROM WORK_TASK WHERE ID = ? FOR UPDATE";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(taskId))
                .map(rows -> SqlSupport.first(rows, this::mapRow))
                .onFailure(error -> log.error("Failed to lock task {}: {}", taskId, error.getMessage()));
    }

    @Override
    public Future<List<WorkTask>> findByWorkDay(String workDayId, SqlConnection connection) {
        String sql = "SELECT " + COLUMNS + " FROM WORK_TASK WHERE WORK_DAY_ID = ? ORDER BY CREATED_AT, ID";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(workDayId))
                .map(rows -> SqlSupport.all(rows, this::mapRow))
                .onFailure(error -> log.error("Failed to list tasks of work day {}: {}", workDayId, error.getMessage()));
    }

    @Override
    public Future<Boolean> insertIfAbsent(WorkTask task, SqlConnection connection) {
        String countSql = "SELECT COUNT(*) AS CNT FROM WORK_TASK WHERE ID = ?";
        String insertSql = "INSERT INTO WORK_TASK (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        return connection.preparedQuery(countSql)
                .execute(Tuple.of(task.getId()))
                .map(rows -> rows.iterator().next().getInteger("CNT"))
                .compose(count -> {
                    if (count > 0) {
                        log.debug("Task {} already exists", task.getId());
                        return Future.succeededFuture(false);
                    }
                    Tuple params = Tuple.of(
                            task.getId(),
                            task.getWorkDayId(),
                            task.getTaskTypeId(),
                            task.getQuantity(),
                            task.getNote(),
                            task.getStatus().getValue(),
                            task.getDecidedBy(),
                            task.getDecidedAt(),
                            task.getDecisionReason(),
                            task.getApprovedPay(),
                            task.getPaidRunId(),
                            task.getPaidAt(),
                            task.getUpdatedBy(),
                            task.getUpdatedAt(),
                            task.getCreatedAt()
                    );
                    return connection.preparedQuery(insertSql)
                            .execute(params)
                            .<Boolean>map(result -> result.rowCount() > 0)
                            .recover(error -> SqlSupport.duplicateAsConflict(error, "Task " + task.getId()));
                })
                .onFailure(error -> {
                    if (!(error instanceof DuplicateEntryException)) {
                        log.error("Failed to insert task {}: {}", task.getId(), error.getMessage());
                    }
                });
    }

    @Override
    public Future<Integer> applyPatch(String taskId, WorkTaskPatch patch, String updatedBy, LocalDateTime updatedAt,
                                      SqlConnection connection) {
        SqlSupport.ColumnPatch columns = new SqlSupport.ColumnPatch()
                .set("QUANTITY", patch.quantity())
                .set("NOTE", patch.note())
                .set("TASK_TYPE_ID", patch.taskTypeId())
                .set("UPDATED_BY", updatedBy)
                .set("UPDATED_AT", updatedAt);

        String sql = "UPDATE WORK_TASK SET " + columns.assignments()
                + " WHERE ID = ? AND STATUS = ? AND PAID_RUN_ID IS NULL";
        Tuple params = columns.params()
                .addString(taskId)
                .addString(TaskStatus.PENDING.getValue());

        return connection.preparedQuery(sql)
                .execute(params)
                .map(result -> result.rowCount())
                .onFailure(error -> log.error("Failed to update task {}: {}", taskId, error.getMessage()));
    }

    @Override
    public Future<Integer> deletePending(String taskId, SqlConnection connection) {
        String sql = "DELETE FROM WORK_TASK WHERE ID = ? AND STATUS = ? AND PAID_RUN_ID IS NULL";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(taskId, TaskStatus.PENDING.getValue()))
                .map(result -> result.rowCount())
                .onFailure(error -> log.error("Failed to delete task {}: {}", taskId, error.getMessage()));
    }

    @Override
    public Future<Integer> recordDecision(TaskDecision decision, SqlConnection connection) {
        String sql = "UPDATE WORK_TASK SET STATUS = ?, DECIDED_BY = ?, DECIDED_AT = ?, DECISION_REASON = ?, "
                + "APPROVED_PAY = ?, UPDATED_BY = ?, UPDATED_AT = ? "
                + "WHERE ID = ? AND PAID_RUN_ID IS NULL "
                + "AND WORK_DAY_ID IN (SELECT ID FROM WORK_DAY WHERE IS_CLOSED = 0)";

        Tuple params = Tuple.of(
                decision.status().getValue(),
                decision.decidedBy(),
                decision.decidedAt(),
                decision.reason(),
                decision.approvedPay(),
                decision.decidedBy(),
                decision.decidedAt(),
                decision.taskId()
        );

        return connection.preparedQuery(sql)
                .execute(params)
                .map(result -> result.rowCount())
                .onFailure(error -> log.error("Failed to record decision on task {}: {}",
                        decision.taskId(), error.getMessage()));
    }

    @Override
    public Future<List<WorkTask>> findApprovedUnpaid(String workerId, SettlementPeriod period, boolean lock,
                                                     SqlConnection connection) {
        // Subquery instead of a join: FOR UPDATE locks only WORK_TASK rows
        String sql = "SELECT " + COLUMNS + " FROM WORK_TASK "
                + "WHERE STATUS = ? AND PAID_RUN_ID IS NULL "
                + "AND WORK_DAY_ID IN (SELECT ID FROM WORK_DAY WHERE WORKER_ID = ? AND WORK_DATE BETWEEN ? AND ?) "
                + "ORDER BY ID"
                + (lock ? " FOR UPDATE" : "");

        Tuple params = Tuple.of(TaskStatus.APPROVED.getValue(), workerId, period.start(), period.end());

        return connection.preparedQuery(sql)
                .execute(params)
                .map(rows -> SqlSupport.all(rows, this::mapRow))
                .onSuccess(tasks -> log.debug("Worker {} has {} approved unpaid tasks in {}..{}",
                        workerId, tasks.size(), period.start(), period.end()))
                .onFailure(error -> log.error("Failed to load approved tasks of worker {}: {}",
                        workerId, error.getMessage()));
    }

    @Override
    public Future<Integer> claimForRun(List<String> taskIds, String runId, LocalDateTime paidAt,
                                       SqlConnection connection) {
        if (taskIds.isEmpty()) {
            return Future.succeededFuture(0);
        }

        String sql = "UPDATE WORK_TASK SET PAID_RUN_ID = ?, PAID_AT = ? "
                + "WHERE STATUS = ? AND PAID_RUN_ID IS NULL "
                + "AND ID IN (" + SqlSupport.placeholders(taskIds.size()) + ")";

        Tuple params = Tuple.of(runId, paidAt, TaskStatus.APPROVED.getValue());
        taskIds.forEach(params::addString);

        return connection.preparedQuery(sql)
                .execute(params)
                .map(result -> result.rowCount())
                .onSuccess(claimed -> log.debug("Run {} claimed {} of {} tasks", runId, claimed, taskIds.size()))
                .onFailure(error -> log.error("Failed to claim tasks for run {}: {}", runId, error.getMessage()));
    }

    @Override
    public Future<List<PendingTask>> findPending(String workerId, LocalDate start, LocalDate end, String loggedBy,
                                                 SqlConnection connection) {
        StringBuilder sql = new StringBuilder(
                "SELECT wt.ID AS TASK_ID, wd.WORK_DATE, wd.WORKER_ID, w.FULL_NAME, tt.CODE, tt.NAME, tt.UNIT, "
                        + "wt.QUANTITY, wt.NOTE, wt.CREATED_AT "
                        + "FROM WORK_TASK wt "
                        + "JOIN WORK_DAY wd ON wd.ID = wt.WORK_DAY_ID "
                        + "JOIN WORKER w ON w.ID = wd.WORKER_ID "
                        + "JOIN TASK_TYPE tt ON tt.ID = wt.TASK_TYPE_ID "
                        + "WHERE wt.STATUS = ?");
        Tuple params = Tuple.of(TaskStatus.PENDING.getValue());

        if (workerId != null) {
            sql.append(" AND wd.WORKER_ID = ?");
            params.addString(workerId);
        }
        if (start != null) {
            sql.append(" AND wd.WORK_DATE >= ?");
            params.addValue(start);
        }
        if (end != null) {
            sql.append(" AND wd.WORK_DATE <= ?");
            params.addValue(end);
        }
        if (loggedBy != null) {
            sql.append(" AND wd.LOGGED_BY = ?");
            params.addString(loggedBy);
        }
        sql.append(" ORDER BY wd.WORK_DATE DESC, wt.CREATED_AT ASC, wt.ID");

        return connection.preparedQuery(sql.toString())
                .execute(params)
                .map(rows -> SqlSupport.all(rows, row -> new PendingTask(
                        row.getString("TASK_ID"),
                        row.getLocalDate("WORK_DATE"),
                        row.getString("WORKER_ID"),
                        row.getString("FULL_NAME"),
                        row.getString("CODE"),
                        row.getString("NAME"),
                        row.getString("UNIT"),
                        row.getBigDecimal("QUANTITY"),
                        row.getString("NOTE"),
                        row.getLocalDateTime("CREATED_AT")
                )))
                .onFailure(error -> log.error("Failed to list pending tasks: {}", error.getMessage()));
    }

    private WorkTask mapRow(Row row) {
        return WorkTask.builder()
                .id(row.getString("ID"))
                .workDayId(row.getString("WORK_DAY_ID"))
                .taskTypeId(row.getString("TASK_TYPE_ID"))
                .quantity(row.getBigDecimal("QUANTITY"))
                .note(row.getString("NOTE"))
                .status(TaskStatus.fromValue(row.getString("STATUS")))
                .decidedBy(row.getString("DECIDED_BY"))
                .decidedAt(row.getLocalDateTime("DECIDED_AT"))
                .decisionReason(row.getString("DECISION_REASON"))
                .approvedPay(row.getBigDecimal("APPROVED_PAY"))
                .paidRunId(row.getString("PAID_RUN_ID"))
                .paidAt(row.getLocalDateTime("PAID_AT"))
                .updatedBy(row.getString("UPDATED_BY"))
                .updatedAt(row.getLocalDateTime("UPDATED_AT"))
                .createdAt(row.getLocalDateTime("CREATED_AT"))
                .build();
    }
}
