package com.fibrepay.application.port.out;

import com.fibrepay.domain.model.Worker;
import com.fibrepay.domain.model.WorkerPatch;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;

import java.util.List;
import java.util.Optional;

/**
 * Output port - persistence of workers
 */
public interface WorkerRepository {

    Future<Optional<Worker>> findById(String workerId, SqlConnection connection);

    /**
     * Active workers ordered by name
     * @param factoryId restrict to one factory, null for all
     */
    Future<List<Worker>> findActive(String factoryId, SqlConnection connection);

    Future<List<Worker>> findAll(boolean includeInactive, SqlConnection connection);

    Future<Void> insert(Worker worker, SqlConnection connection);

    /**
     * Apply the non-null fields of the patch
     * @return number of rows updated
     */
    Future<Integer> update(String workerId, WorkerPatch patch, SqlConnection connection);
}
