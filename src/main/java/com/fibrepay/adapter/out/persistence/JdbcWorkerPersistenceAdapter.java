package com.fibrepay.adapter.out.persistence;

import com.fibrepay.application.port.out.WorkerRepository;
import com.fibrepay.domain.model.PayoutFrequency;
import com.fibrepay.domain.model.Worker;
import com.fibrepay.domain.model.WorkerPatch;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of WorkerRepository
 */
@Slf4j
public class JdbcWorkerPersistenceAdapter implements WorkerRepository {

    private static final String COLUMNS =
            "ID, WORKER_CODE, FULL_NAME, FACTORY_ID, PAYOUT, PAYOUT_ANCHOR_DATE, IS_ACTIVE, CREATED_AT";

    @Override
    public Future<Optional<Worker>> findById(String workerId, SqlConnection connection) {
        String sql = "SELECT " + COLUMNS + " FROM WORKER WHERE ID = ?";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(workerId))
                .map(rows -> SqlSupport.first(rows, this::mapRow))
                .onFailure(error -> log.error("Failed to find worker {}: {}", workerId, error.getMessage()));
    }

    @Override
    public Future<List<Worker>> findActive(String factoryId, SqlConnection connection) {
        String sql = "SELECT " + COLUMNS + " FROM WORKER WHERE IS_ACTIVE = 1";
        Tuple params = Tuple.tuple();
        if (factoryId != null) {
            sql += " AND FACTORY_ID = ?";
            params.addString(factoryId);
        }
        sql += " ORDER BY FULL_NAME, ID";

        return connection.preparedQuery(sql)
                .execute(params)
                .map(rows -> SqlSupport.all(rows, this::mapRow))
                .onSuccess(workers -> log.debug("Found {} active workers (factory {})", workers.size(), factoryId))
                .onFailure(error -> log.error("Failed to list active workers: {}", error.getMessage()));
    }

    @Override
    public Future<List<Worker>> findAll(boolean includeInactive, SqlConnection connection) {
        String sql = "SELECT " + COLUMNS + " FROM WORKER"
                + (includeInactive ? "" : " WHERE IS_ACTIVE = 1")
                + " ORDER BY FULL_NAME, ID";

        return connection.query(sql)
                .execute()
                .map(rows -> SqlSupport.all(rows, this::mapRow))
                .onFailure(error -> log.error("Failed to list workers: {}", error.getMessage()));
    }

    @Override
    public Future<Void> insert(Worker worker, SqlConnection connection) {
        String sql = "INSERT INTO WORKER (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

        Tuple params = Tuple.of(
                worker.getId(),
                worker.getWorkerCode(),
                worker.getFullName(),
                worker.getFactoryId(),
                worker.getPayout().getValue(),
                worker.getPayoutAnchorDate(),
                SqlSupport.flag(worker.isActive()),
                worker.getCreatedAt()
        );

        return connection.preparedQuery(sql)
                .execute(params)
                .onFailure(error -> log.error("Failed to insert worker {}: {}", worker.getId(), error.getMessage()))
                .mapEmpty();
    }

    @Override
    public Future<Integer> update(String workerId, WorkerPatch patch, SqlConnection connection) {
        SqlSupport.ColumnPatch columns = new SqlSupport.ColumnPatch()
                .set("WORKER_CODE", patch.workerCode())
                .set("FULL_NAME", patch.fullName())
                .set("FACTORY_ID", patch.factoryId())
                .set("PAYOUT", patch.payout() != null ? patch.payout().getValue() : null)
                .set("PAYOUT_ANCHOR_DATE", patch.payoutAnchorDate())
                .set("IS_ACTIVE", patch.active() != null ? SqlSupport.flag(patch.active()) : null);
        if (columns.isEmpty()) {
            return Future.succeededFuture(0);
        }

        String sql = "UPDATE WORKER SET " + columns.assignments() + " WHERE ID = ?";
        Tuple params = columns.params().addString(workerId);

        return connection.preparedQuery(sql)
                .execute(params)
                .map(result -> result.rowCount())
                .onSuccess(updated -> log.debug("Updated worker {}: {} row(s)", workerId, updated))
                .onFailure(error -> log.error("Failed to update worker {}: {}", workerId, error.getMessage()));
    }

    private Worker mapRow(Row row) {
        return Worker.builder()
                .id(row.getString("ID"))
                .workerCode(row.getString("WORKER_CODE"))
                .fullName(row.getString("FULL_NAME"))
                .factoryId(row.getString("FACTORY_ID"))
                .payout(PayoutFrequency.fromValue(row.getString("PAYOUT")))
                .payoutAnchorDate(row.getLocalDate("PAYOUT_ANCHOR_DATE"))
                .active(SqlSupport.toBoolean(row.getValue("IS_ACTIVE")))
                .createdAt(row.getLocalDateTime("CREATED_AT"))
                .build();
    }
}
