package com.fibrepay.adapter.out.persistence;

import com.fibrepay.application.port.out.PayrollRunRepository;
import com.fibrepay.domain.model.PayoutFrequency;
import com.fibrepay.domain.model.PayrollRun;
import com.fibrepay.domain.model.PayrollRunItem;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of PayrollRunRepository.
 * PK_PAYROLL_RUN_ITEM keeps one item per (run, worker).
 */
@Slf4j
public class JdbcPayrollRunPersistenceAdapter implements PayrollRunRepository {

    private static final String RUN_COLUMNS = "ID, AS_OF, CREATED_BY, NOTE, CREATED_AT";
    private static final String ITEM_COLUMNS = "RUN_ID, WORKER_ID, WORKER_NAME, PAYOUT, PERIOD_START, PERIOD_END, "
            + "APPROVED_TOTAL_PAY, APPROVED_COMBED_KG, APPROVED_WOVEN_M, TASK_COUNT";

    @Override
    public Future<Void> insertRun(PayrollRun run, SqlConnection connection) {
        String sql = "INSERT INTO PAYROLL_RUN (" + RUN_COLUMNS + ") VALUES (?, ?, ?, ?, ?)";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(run.getId(), run.getAsOf(), run.getCreatedBy(), run.getNote(), run.getCreatedAt()))
                .onSuccess(result -> log.debug("Inserted payroll run {}", run.getId()))
                .onFailure(error -> log.error("Failed to insert payroll run {}: {}", run.getId(), error.getMessage()))
                .mapEmpty();
    }

    @Override
    public Future<Boolean> insertItemIfAbsent(PayrollRunItem item, SqlConnection connection) {
        String countSql = "SELECT COUNT(*) AS CNT FROM PAYROLL_RUN_ITEM WHERE RUN_ID = ? AND WORKER_ID = ?";
        String insertSql = "INSERT INTO PAYROLL_RUN_ITEM (" + ITEM_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        return connection.preparedQuery(countSql)
                .execute(Tuple.of(item.getRunId(), item.getWorkerId()))
                .map(rows -> rows.iterator().next().getInteger("CNT"))
                .compose(count -> {
                    if (count > 0) {
                        return Future.succeededFuture(false);
                    }
                    Tuple params = Tuple.of(
                            item.getRunId(),
                            item.getWorkerId(),
                            item.getWorkerName(),
                            item.getPayout().getValue(),
                            item.getPeriodStart(),
                            item.getPeriodEnd(),
                            item.getApprovedTotalPay(),
                            item.getApprovedCombedKg(),
                            item.getApprovedWovenM(),
                            item.getTaskCount()
                    );
                    return connection.preparedQuery(insertSql)
                            .execute(params)
                            .map(result -> result.rowCount() > 0);
                })
                .onFailure(error -> log.error("Failed to insert item of run {} for worker {}: {}",
                        item.getRunId(), item.getWorkerId(), error.getMessage()));
    }

    @Override
    public Future<Optional<PayrollRun>> findRun(String runId, SqlConnection connection) {
        String sql = "SELECT " + RUN_COLUMNS + " FROM PAYROLL_RUN WHERE ID = ?";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(runId))
                .map(rows -> SqlSupport.first(rows, this::mapRun))
                .onFailure(error -> log.error("Failed to find payroll run {}: {}", runId, error.getMessage()));
    }

    @Override
    public Future<List<PayrollRunItem>> findItems(String runId, SqlConnection connection) {
        String sql = "SELECT " + ITEM_COLUMNS + " FROM PAYROLL_RUN_ITEM WHERE RUN_ID = ? ORDER BY WORKER_NAME, WORKER_ID";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(runId))
                .map(rows -> SqlSupport.all(rows, this::mapItem))
                .onFailure(error -> log.error("Failed to list items of run {}: {}", runId, error.getMessage()));
    }

    @Override
    public Future<List<PayrollRun>> findRecent(int limit, SqlConnection connection) {
        String sql = "SELECT " + RUN_COLUMNS + " FROM PAYROLL_RUN ORDER BY CREATED_AT DESC, ID "
                + "FETCH FIRST " + limit + " ROWS ONLY";

        return connection.query(sql)
                .execute()
                .map(rows -> SqlSupport.all(rows, this::mapRun))
                .onFailure(error -> log.error("Failed to list payroll runs: {}", error.getMessage()));
    }

    private PayrollRun mapRun(Row row) {
        return PayrollRun.builder()
                .id(row.getString("ID"))
                .asOf(row.getLocalDate("AS_OF"))
                .createdBy(row.getString("CREATED_BY"))
                .note(row.getString("NOTE"))
                .createdAt(row.getLocalDateTime("CREATED_AT"))
                .build();
    }

    private PayrollRunItem mapItem(Row row) {
        return PayrollRunItem.builder()
                .runId(row.getString("RUN_ID"))
                .workerId(row.getString("WORKER_ID"))
                .workerName(row.getString("WORKER_NAME"))
                .payout(PayoutFrequency.fromValue(row.getString("PAYOUT")))
                .periodStart(row.getLocalDate("PERIOD_START"))
                .periodEnd(row.getLocalDate("PERIOD_END"))
                .approvedTotalPay(row.getBigDecimal("APPROVED_TOTAL_PAY"))
                .approvedCombedKg(row.getBigDecimal("APPROVED_COMBED_KG"))
                .approvedWovenM(row.getBigDecimal("APPROVED_WOVEN_M"))
                .taskCount(row.getInteger("TASK_COUNT"))
                .build();
    }
}
