package com.fibrepay.application.service;

import com.fibrepay.application.port.in.PayrollRunUseCase;
import com.fibrepay.application.port.out.PayrollRunRepository;
import com.fibrepay.application.port.out.TaskTypeRepository;
import com.fibrepay.application.port.out.WorkTaskRepository;
import com.fibrepay.application.port.out.WorkerRepository;
import com.fibrepay.domain.event.AuditActions;
import com.fibrepay.domain.exception.ConflictException;
import com.fibrepay.domain.exception.NotFoundException;
import com.fibrepay.domain.exception.ValidationException;
import com.fibrepay.domain.model.Money;
import com.fibrepay.domain.model.PayrollRun;
import com.fibrepay.domain.model.PayrollRunItem;
import com.fibrepay.domain.model.PayrollTotals;
import com.fibrepay.domain.model.SettlementPeriod;
import com.fibrepay.domain.model.TaskCategory;
import com.fibrepay.domain.model.TaskType;
import com.fibrepay.domain.model.WorkTask;
import com.fibrepay.domain.model.Worker;
import io.vertx.core.Future;
import io.vertx.jdbcclient.JDBCPool;
import io.vertx.sqlclient.SqlConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Settlement engine. A run pays each active worker's approved, unpaid tasks in
 * the period containing the run's as-of date, and marks them paid so no later
 * run can pay them again.
 *
 * <p>The run header commits first. Each worker is then settled in its own
 * transaction: lock the eligible tasks, write the run item, claim the tasks.
 * A worker whose claim comes up short (a concurrent run got there first) is
 * rolled back and left out of this run.
 */
@Slf4j
@RequiredArgsConstructor
public class PayrollRunService implements PayrollRunUseCase {

    static final int MAX_LIST_LIMIT = 200;

    private final JDBCPool jdbcPool;
    private final WorkerRepository workerRepository;
    private final TaskTypeRepository taskTypeRepository;
    private final WorkTaskRepository workTaskRepository;
    private final PayrollRunRepository payrollRunRepository;
    private final PeriodCalculator periodCalculator;
    private final AuditTrail auditTrail;
    private final Clock clock;

    @Override
    public Future<String> createRun(CreateRunCommand command) {
        if (command.asOf() == null) {
            return Future.failedFuture(new ValidationException("asOf is required"));
        }

        PayrollRun run = PayrollRun.builder()
                .id(UUID.randomUUID().toString())
                .asOf(command.asOf())
                .createdBy(command.creator().userId())
                .note(command.note())
                .createdAt(LocalDateTime.now(clock))
                .build();

        log.info("Creating payroll run {} as of {} by {}", run.getId(), run.getAsOf(), run.getCreatedBy());

        // Step 1: Commit the run header and load the active workers
        return jdbcPool.withTransaction(connection -> payrollRunRepository.insertRun(run, connection)
                        .compose(v -> workerRepository.findActive(null, connection))
                        .compose(workers -> taskTypeRepository.findAll(connection)
                                .map(taskTypes -> new RunContext(workers, categoriesOf(taskTypes)))))
                // Step 2: Settle workers one transaction at a time
                .compose(context -> settleWorkers(run, context))
                // Step 3: Audit the run
                .onSuccess(items -> auditRun(command, run, items))
                .onSuccess(items -> log.info("Payroll run {} settled {} workers", run.getId(), items.size()))
                .onFailure(error -> log.error("Payroll run {} failed: {}", run.getId(), error.getMessage()))
                .map(run.getId());
    }

    @Override
    public Future<RunDetails> findRun(String runId) {
        return jdbcPool.withConnection(connection -> payrollRunRepository.findRun(runId, connection)
                .compose(found -> Required.present(found, () -> NotFoundException.of("Payroll run", runId)))
                .compose(run -> payrollRunRepository.findItems(runId, connection)
                        .map(items -> new RunDetails(run, items))));
    }

    @Override
    public Future<List<PayrollRun>> listRuns(int limit) {
        int clamped = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        return jdbcPool.withConnection(connection -> payrollRunRepository.findRecent(clamped, connection));
    }

    private Future<List<PayrollRunItem>> settleWorkers(PayrollRun run, RunContext context) {
        List<PayrollRunItem> items = new ArrayList<>();

        Future<Void> chain = Future.succeededFuture();
        for (Worker worker : context.workers()) {
            chain = chain.compose(v -> settleWorker(run, worker, context.categories())
                    .map(item -> {
                        item.ifPresent(items::add);
                        return null;
                    }));
        }

        return chain.map(items);
    }

    /**
     * Settle one worker in its own transaction. Failures are logged and the
     * worker is skipped; the tasks stay unpaid for a later run.
     */
    private Future<Optional<PayrollRunItem>> settleWorker(PayrollRun run, Worker worker,
                                                          Map<String, TaskCategory> categories) {
        return Future.succeededFuture(worker)
                .map(w -> periodCalculator.settlementPeriod(w.getPayout(), w.getPayoutAnchorDate(), run.getAsOf()))
                .compose(period -> jdbcPool.withTransaction(connection ->
                        workTaskRepository.findApprovedUnpaid(worker.getId(), period, true, connection)
                                .compose(tasks -> payTasks(run, worker, period, tasks, categories, connection))))
                .recover(error -> {
                    log.error("Settlement of worker {} in run {} failed, worker skipped: {}",
                            worker.getId(), run.getId(), error.getMessage());
                    return Future.succeededFuture(Optional.empty());
                });
    }

    private Future<Optional<PayrollRunItem>> payTasks(
            PayrollRun run,
            Worker worker,
            SettlementPeriod period,
            List<WorkTask> tasks,
            Map<String, TaskCategory> categories,
            SqlConnection connection
    ) {
        if (tasks.isEmpty()) {
            log.debug("Worker {} has nothing to settle in {}..{}", worker.getId(), period.start(), period.end());
            return Future.succeededFuture(Optional.empty());
        }

        PayrollTotals totals = PayrollTotals.of(tasks, categories);
        PayrollRunItem item = PayrollRunItem.builder()
                .runId(run.getId())
                .workerId(worker.getId())
                .workerName(worker.getFullName())
                .payout(worker.getPayout())
                .periodStart(period.start())
                .periodEnd(period.end())
                .approvedTotalPay(totals.totalPay())
                .approvedCombedKg(totals.combedKg())
                .approvedWovenM(totals.wovenM())
                .taskCount(totals.taskCount())
                .build();

        return payrollRunRepository.insertItemIfAbsent(item, connection)
                .compose(inserted -> {
                    if (!inserted) {
                        // Claiming without an item would leave the item totals short
                        log.warn("Run {} already has an item for worker {}, tasks left unclaimed",
                                run.getId(), worker.getId());
                        return Future.succeededFuture(Optional.<PayrollRunItem>empty());
                    }
                    return claimTasks(run, worker, tasks, connection).map(v -> Optional.of(item));
                });
    }

    private Future<Void> claimTasks(PayrollRun run, Worker worker, List<WorkTask> tasks, SqlConnection connection) {
        List<String> taskIds = tasks.stream().map(WorkTask::getId).collect(Collectors.toList());

        return workTaskRepository.claimForRun(taskIds, run.getId(), run.getCreatedAt(), connection)
                .compose(claimed -> {
                    if (claimed != taskIds.size()) {
                        return Future.failedFuture(new ConflictException(String.format(
                                "Claimed %d of %d tasks for worker %s, another run holds the rest",
                                claimed, taskIds.size(), worker.getId())));
                    }
                    log.debug("Run {} claimed {} tasks of worker {}", run.getId(), claimed, worker.getId());
                    return Future.succeededFuture();
                });
    }

    private void auditRun(CreateRunCommand command, PayrollRun run, List<PayrollRunItem> items) {
        BigDecimal totalPay = items.stream()
                .map(PayrollRunItem::getApprovedTotalPay)
                .reduce(Money.ZERO, BigDecimal::add);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("asOf", run.getAsOf().toString());
        metadata.put("items", items.size());
        metadata.put("totalPay", totalPay.toPlainString());

        auditTrail.record(command.creator(), AuditActions.PAYROLL_RUN_CREATE, AuditActions.ENTITY_PAYROLL_RUN,
                run.getId(), metadata);
    }

    static Map<String, TaskCategory> categoriesOf(List<TaskType> taskTypes) {
        return taskTypes.stream().collect(Collectors.toMap(TaskType::getId, TaskType::getCategory));
    }

    private record RunContext(List<Worker> workers, Map<String, TaskCategory> categories) {
    }
}
