package com.fibrepay.adapter.out.persistence;

import com.fibrepay.application.port.out.WorkDayRepository;
import com.fibrepay.domain.exception.DuplicateEntryException;
import com.fibrepay.domain.model.WorkDay;
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
 * JDBC implementation of WorkDayRepository.
 * UQ_WORK_DAY keeps one day per (worker, date).
 */
@Slf4j
public class JdbcWorkDayPersistenceAdapter implements WorkDayRepository {

    private static final String COLUMNS =
            "ID, WORKER_ID, WORK_DATE, LOGGED_BY, WORKSTATION_ID, DAY_NOTE, IS_CLOSED, CLOSED_BY, CLOSED_AT, CREATED_AT";

    @Override
    public Future<Optional<WorkDay>> findById(String workDayId, SqlConnection connection) {
        String sql = "SELECT " + COLUMNS + " FROM WORK_DAY WHERE ID = ?";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(workDayId))
                .map(rows -> SqlSupport.first(rows, this::mapRow))
                .onFailure(error -> log.error("Failed to find work day {}: {}", workDayId, error.getMessage()));
    }

    @Override
    public Future<Optional<WorkDay>> findByWorkerAndDate(String workerId, LocalDate workDate, SqlConnection connection) {
        String sql = "SELECT " + COLUMNS + " FROM WORK_DAY WHERE WORKER_ID = ? AND WORK_DATE = ?";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(workerId, workDate))
                .map(rows -> SqlSupport.first(rows, this::mapRow))
                .onFailure(error -> log.error("Failed to find work day of worker {} on {}: {}",
                        workerId, workDate, error.getMessage()));
    }

    @Override
    public Future<List<WorkDay>> findByWorker(String workerId, LocalDate start, LocalDate end, SqlConnection connection) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM WORK_DAY WHERE WORKER_ID = ?");
        Tuple params = Tuple.of(workerId);
        if (start != null) {
            sql.append(" AND WORK_DATE >= ?");
            params.addValue(start);
        }
        if (end != null) {
            sql.append(" AND WORK_DATE <= ?");
            params.addValue(end);
        }
        sql.append(" ORDER BY WORK_DATE DESC");

        return connection.preparedQuery(sql.toString())
                .execute(params)
                .map(rows -> SqlSupport.all(rows, this::mapRow))
                .onFailure(error -> log.error("Failed to list work days of worker {}: {}", workerId, error.getMessage()));
    }

    @Override
    public Future<Void> insert(WorkDay workDay, SqlConnection connection) {
        String sql = "INSERT INTO WORK_DAY (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        Tuple params = Tuple.of(
                workDay.getId(),
                workDay.getWorkerId(),
                workDay.getWorkDate(),
                workDay.getLoggedBy(),
                workDay.getWorkstationId(),
                workDay.getNote(),
                SqlSupport.flag(workDay.isClosed()),
                workDay.getClosedBy(),
                workDay.getClosedAt(),
                workDay.getCreatedAt()
        );

        return connection.preparedQuery(sql)
                .execute(params)
                .<Void>mapEmpty()
                .recover(error -> SqlSupport.duplicateAsConflict(error,
                        "Work day of worker " + workDay.getWorkerId() + " on " + workDay.getWorkDate()))
                .onFailure(error -> {
                    if (!(error instanceof DuplicateEntryException)) {
                        log.error("Failed to insert work day {}: {}", workDay.getId(), error.getMessage());
                    }
                });
    }

    @Override
    public Future<Void> updateDetails(String workDayId, String workstationId, String note, SqlConnection connection) {
        String sql = "UPDATE WORK_DAY SET WORKSTATION_ID = ?, DAY_NOTE = ? WHERE ID = ? AND IS_CLOSED = 0";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(workstationId, note, workDayId))
                .onFailure(error -> log.error("Failed to update work day {}: {}", workDayId, error.getMessage()))
                .mapEmpty();
    }

    @Override
    public Future<Integer> close(String workDayId, String closedBy, LocalDateTime closedAt, SqlConnection connection) {
        String sql = "UPDATE WORK_DAY SET IS_CLOSED = 1, CLOSED_BY = ?, CLOSED_AT = ? WHERE ID = ? AND IS_CLOSED = 0";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(closedBy, closedAt, workDayId))
                .map(result -> result.rowCount())
                .onFailure(error -> log.error("Failed to close work day {}: {}", workDayId, error.getMessage()));
    }

    @Override
    public Future<Integer> reopen(String workDayId, SqlConnection connection) {
        String sql = "UPDATE WORK_DAY SET IS_CLOSED = 0, CLOSED_BY = NULL, CLOSED_AT = NULL WHERE ID = ? AND IS_CLOSED = 1";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(workDayId))
                .map(result -> result.rowCount())
                .onFailure(error -> log.error("Failed to reopen work day {}: {}", workDayId, error.getMessage()));
    }

    private WorkDay mapRow(Row row) {
        return WorkDay.builder()
                .id(row.getString("ID"))
                .workerId(row.getString("WORKER_ID"))
                .workDate(row.getLocalDate("WORK_DATE"))
                .loggedBy(row.getString("LOGGED_BY"))
                .workstationId(row.getString("WORKSTATION_ID"))
                .note(row.getString("DAY_NOTE"))
                .closed(SqlSupport.toBoolean(row.getValue("IS_CLOSED")))
                .closedBy(row.getString("CLOSED_BY"))
                .closedAt(row.getLocalDateTime("CLOSED_AT"))
                .createdAt(row.getLocalDateTime("CREATED_AT"))
                .build();
    }
}
