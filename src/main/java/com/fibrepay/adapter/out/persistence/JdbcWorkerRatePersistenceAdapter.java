package com.fibrepay.adapter.out.persistence;

import com.fibrepay.application.port.out.WorkerRateRepository;
import com.fibrepay.domain.model.WorkerRate;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of WorkerRateRepository.
 * UQ_WORKER_RATE keeps one override per (worker, task type).
 */
@Slf4j
public class JdbcWorkerRatePersistenceAdapter implements WorkerRateRepository {

    @Override
    public Future<Optional<BigDecimal>> findRate(String workerId, String taskTypeId, SqlConnection connection) {
        String sql = "SELECT RATE FROM WORKER_RATE WHERE WORKER_ID = ? AND TASK_TYPE_ID = ?";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(workerId, taskTypeId))
                .map(rows -> SqlSupport.first(rows, row -> row.getBigDecimal("RATE")))
                .onFailure(error -> log.error("Failed to get rate for worker {} task type {}: {}",
                        workerId, taskTypeId, error.getMessage()));
    }

    @Override
    public Future<List<WorkerRate>> findByWorker(String workerId, SqlConnection connection) {
        String sql = "SELECT ID, WORKER_ID, TASK_TYPE_ID, RATE FROM WORKER_RATE WHERE WORKER_ID = ? ORDER BY TASK_TYPE_ID";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(workerId))
                .map(rows -> SqlSupport.all(rows, this::mapRow))
                .onFailure(error -> log.error("Failed to list rates of worker {}: {}", workerId, error.getMessage()));
    }

    @Override
    public Future<String> upsert(WorkerRate rate, SqlConnection connection) {
        String findSql = "SELECT ID FROM WORKER_RATE WHERE WORKER_ID = ? AND TASK_TYPE_ID = ?";

        return connection.preparedQuery(findSql)
                .execute(Tuple.of(rate.getWorkerId(), rate.getTaskTypeId()))
                .map(rows -> SqlSupport.first(rows, row -> row.getString("ID")))
                .compose(existingId -> {
                    if (existingId.isPresent()) {
                        return connection.preparedQuery("UPDATE WORKER_RATE SET RATE = ? WHERE ID = ?")
                                .execute(Tuple.of(rate.getRate(), existingId.get()))
                                .map(existingId.get());
                    }
                    return connection.preparedQuery(
                                    "INSERT INTO WORKER_RATE (ID, WORKER_ID, TASK_TYPE_ID, RATE) VALUES (?, ?, ?, ?)")
                            .execute(Tuple.of(rate.getId(), rate.getWorkerId(), rate.getTaskTypeId(), rate.getRate()))
                            .map(rate.getId());
                })
                .onSuccess(id -> log.debug("Stored rate {} for worker {} task type {}", id, rate.getWorkerId(), rate.getTaskTypeId()))
                .onFailure(error -> log.error("Failed to store rate for worker {}: {}", rate.getWorkerId(), error.getMessage()));
    }

    @Override
    public Future<Boolean> delete(String rateId, SqlConnection connection) {
        return connection.preparedQuery("DELETE FROM WORKER_RATE WHERE ID = ?")
                .execute(Tuple.of(rateId))
                .map(result -> result.rowCount() > 0)
                .onFailure(error -> log.error("Failed to delete rate {}: {}", rateId, error.getMessage()));
    }

    private WorkerRate mapRow(Row row) {
        return WorkerRate.builder()
                .id(row.getString("ID"))
                .workerId(row.getString("WORKER_ID"))
                .taskTypeId(row.getString("TASK_TYPE_ID"))
                .rate(row.getBigDecimal("RATE"))
                .build();
    }
}
