package com.fibrepay.application.service;

import com.fibrepay.application.port.in.PayrollQueryUseCase;
import com.fibrepay.application.port.out.TaskTypeRepository;
import com.fibrepay.application.port.out.WorkTaskRepository;
import com.fibrepay.application.port.out.WorkerRepository;
import com.fibrepay.domain.exception.NotFoundException;
import com.fibrepay.domain.model.Actor;
import com.fibrepay.domain.model.PayrollTotals;
import com.fibrepay.domain.model.SettlementPeriod;
import com.fibrepay.domain.model.TaskCategory;
import com.fibrepay.domain.model.Worker;
import com.fibrepay.domain.model.WorkerPayroll;
import io.vertx.core.Future;
import io.vertx.jdbcclient.JDBCPool;
import io.vertx.sqlclient.SqlConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-only payroll views. Totals are the pay stored on each task at decision
 * time, never recomputed from current rates.
 */
@Slf4j
@RequiredArgsConstructor
public class PayrollQueryService implements PayrollQueryUseCase {

    private final JDBCPool jdbcPool;
    private final WorkerRepository workerRepository;
    private final TaskTypeRepository taskTypeRepository;
    private final WorkTaskRepository workTaskRepository;
    private final PeriodCalculator periodCalculator;
    private final AuthorizationPolicy authorizationPolicy;
    private final Clock clock;

    @Override
    public Future<WorkerPayroll> workerPayroll(String workerId, LocalDate asOf) {
        LocalDate date = asOf != null ? asOf : LocalDate.now(clock);

        return jdbcPool.withConnection(connection -> workerRepository.findById(workerId, connection)
                .compose(found -> Required.present(found, () -> NotFoundException.of("Worker", workerId)))
                .compose(worker -> taskTypeRepository.findAll(connection)
                        .compose(taskTypes -> {
                            SettlementPeriod period = periodCalculator.currentProgressPeriod(
                                    worker.getPayout(), worker.getPayoutAnchorDate(), date);
                            return totalsFor(worker, period, PayrollRunService.categoriesOf(taskTypes), connection);
                        })));
    }

    @Override
    public Future<List<WorkerPayroll>> payrollDue(LocalDate asOf, Actor actor) {
        LocalDate date = asOf != null ? asOf : LocalDate.now(clock);
        String factoryId = authorizationPolicy.factoryScope(actor);

        return jdbcPool.withConnection(connection -> workerRepository.findActive(factoryId, connection)
                .compose(workers -> taskTypeRepository.findAll(connection)
                        .compose(taskTypes -> collectDue(workers, date,
                                PayrollRunService.categoriesOf(taskTypes), connection))));
    }

    private Future<List<WorkerPayroll>> collectDue(List<Worker> workers, LocalDate asOf,
                                                   Map<String, TaskCategory> categories, SqlConnection connection) {
        List<WorkerPayroll> due = new ArrayList<>();

        Future<Void> chain = Future.succeededFuture();
        for (Worker worker : workers) {
            SettlementPeriod period = periodCalculator.settlementPeriod(
                    worker.getPayout(), worker.getPayoutAnchorDate(), asOf);
            if (!period.hasEndedBy(asOf)) {
                continue;
            }
            chain = chain.compose(v -> totalsFor(worker, period, categories, connection)
                    .map(payroll -> {
                        if (payroll.totals().isPayable()) {
                            due.add(payroll);
                        }
                        return null;
                    }));
        }

        return chain.map(due)
                .onSuccess(result -> log.debug("{} of {} workers due as of {}", result.size(), workers.size(), asOf));
    }

    private Future<WorkerPayroll> totalsFor(Worker worker, SettlementPeriod period,
                                            Map<String, TaskCategory> categories, SqlConnection connection) {
        return workTaskRepository.findApprovedUnpaid(worker.getId(), period, false, connection)
                .map(tasks -> new WorkerPayroll(
                        worker.getId(),
                        worker.getFullName(),
                        worker.getPayout(),
                        period,
                        tasks.isEmpty() ? PayrollTotals.EMPTY : PayrollTotals.of(tasks, categories)
                ));
    }
}
