package com.fibrepay.application.port.out;

import com.fibrepay.domain.model.WorkDay;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Output port - work days and their open/closed lock
 */
public interface WorkDayRepository {

    Future<Optional<WorkDay>> findById(String workDayId, SqlConnection connection);

    Future<Optional<WorkDay>> findByWorkerAndDate(String workerId, LocalDate workDate, SqlConnection connection);

    /**
     * Days of a worker, newest first
     * @param start inclusive lower bound, null for unbounded
     * @param end inclusive upper bound, null for unbounded
     */
    Future<List<WorkDay>> findByWorker(String workerId, LocalDate start, LocalDate end, SqlConnection connection);

    Future<Void> insert(WorkDay workDay, SqlConnection connection);

    Future<Void> updateDetails(String workDayId, String workstationId, String note, SqlConnection connection);

    /**
     * Close the day if it is still open
     * @return number of rows changed, 0 when already closed
     */
    Future<Integer> close(String workDayId, String closedBy, LocalDateTime closedAt, SqlConnection connection);

    /**
     * Reopen the day if it is closed
     * @return number of rows changed, 0 when already open
     */
    Future<Integer> reopen(String workDayId, SqlConnection connection);
}
