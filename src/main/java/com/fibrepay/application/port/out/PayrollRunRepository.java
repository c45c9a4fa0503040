package com.fibrepay.application.port.out;

import com.fibrepay.domain.model.PayrollRun;
import com.fibrepay.domain.model.PayrollRunItem;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;

import java.util.List;
import java.util.Optional;

/**
 * Output port - payroll runs and their per-worker items
 */
public interface PayrollRunRepository {

    Future<Void> insertRun(PayrollRun run, SqlConnection connection);

    /**
     * Insert the item unless the run already has one for this worker
     * @return true when a row was inserted
     */
    Future<Boolean> insertItemIfAbsent(PayrollRunItem item, SqlConnection connection);

    Future<Optional<PayrollRun>> findRun(String runId, SqlConnection connection);

    /**
     * Items of a run ordered by worker name
     */
    Future<List<PayrollRunItem>> findItems(String runId, SqlConnection connection);

    /**
     * Most recent runs first
     */
    Future<List<PayrollRun>> findRecent(int limit, SqlConnection connection);
}
