package com.fibrepay.application.port.out;

import com.fibrepay.domain.model.WorkerRate;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Output port - worker-specific rate overrides
 */
public interface WorkerRateRepository {

    Future<Optional<BigDecimal>> findRate(String workerId, String taskTypeId, SqlConnection connection);

    Future<List<WorkerRate>> findByWorker(String workerId, SqlConnection connection);

    /**
     * Insert the override or replace the rate of the existing (worker, task type) row
     * @return id of the stored override
     */
    Future<String> upsert(WorkerRate rate, SqlConnection connection);

    Future<Boolean> delete(String rateId, SqlConnection connection);
}
