package com.fibrepay.application.service;

import com.fibrepay.application.port.in.WorkerAdministrationUseCase;
import com.fibrepay.application.port.out.TaskTypeRepository;
import com.fibrepay.application.port.out.WorkerRateRepository;
import com.fibrepay.application.port.out.WorkerRepository;
import com.fibrepay.domain.event.AuditActions;
import com.fibrepay.domain.exception.NotFoundException;
import com.fibrepay.domain.model.Actor;
import com.fibrepay.domain.model.Money;
import com.fibrepay.domain.model.PayoutFrequency;
import com.fibrepay.domain.model.TaskType;
import com.fibrepay.domain.model.Worker;
import com.fibrepay.domain.model.WorkerPatch;
import com.fibrepay.domain.model.WorkerRate;
import io.vertx.core.Future;
import io.vertx.jdbcclient.JDBCPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Application service for workers, task types and worker rate overrides
 */
@Slf4j
@RequiredArgsConstructor
public class WorkerAdministrationService implements WorkerAdministrationUseCase {

    private final JDBCPool jdbcPool;
    private final WorkerRepository workerRepository;
    private final TaskTypeRepository taskTypeRepository;
    private final WorkerRateRepository workerRateRepository;
    private final WorkLogValidator validator;
    private final AuthorizationPolicy authorizationPolicy;
    private final AuditTrail auditTrail;
    private final Clock clock;

    @Override
    public Future<Worker> createWorker(CreateWorkerCommand command, Actor actor) {
        return Future.succeededFuture(command)
                .map(c -> {
                    validator.validate(c).throwIfInvalid();
                    return toWorker(c);
                })
                .compose(worker -> jdbcPool.withTransaction(connection -> workerRepository.insert(worker, connection))
                        .map(worker))
                .onSuccess(worker -> {
                    log.info("Created worker {} ({})", worker.getId(), worker.getFullName());
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("fullName", worker.getFullName());
                    metadata.put("factoryId", worker.getFactoryId());
                    metadata.put("payout", worker.getPayout().getValue());
                    metadata.put("payoutAnchorDate", worker.getPayoutAnchorDate().toString());
                    auditTrail.record(actor, AuditActions.WORKER_CREATE, AuditActions.ENTITY_WORKER, worker.getId(), metadata);
                });
    }

    private Worker toWorker(CreateWorkerCommand command) {
        LocalDateTime now = LocalDateTime.now(clock);
        return Worker.builder()
                .id(UUID.randomUUID().toString())
                .workerCode(command.workerCode())
                .fullName(command.fullName().trim())
                .factoryId(command.factoryId())
                .payout(command.payout() != null ? PayoutFrequency.fromValue(command.payout()) : PayoutFrequency.WEEKLY)
                .payoutAnchorDate(command.payoutAnchorDate() != null ? command.payoutAnchorDate() : now.toLocalDate())
                .active(true)
                .createdAt(now)
                .build();
    }

    @Override
    public Future<Void> updateWorker(String workerId, WorkerPatch patch, Actor actor) {
        return Future.succeededFuture(patch)
                .map(p -> {
                    authorizationPolicy.requireAdmin(actor, "Updating a worker");
                    validator.validate(p).throwIfInvalid();
                    return p;
                })
                .compose(p -> jdbcPool.withTransaction(connection -> workerRepository.findById(workerId, connection)
                        .compose(found -> Required.present(found, () -> NotFoundException.of("Worker", workerId)))
                        .compose(worker -> p.isEmpty()
                                ? Future.succeededFuture(0)
                                : workerRepository.update(workerId, p, connection))))
                .onSuccess(updated -> {
                    if (updated > 0) {
                        auditTrail.record(actor, AuditActions.WORKER_UPDATE, AuditActions.ENTITY_WORKER, workerId,
                                patchMetadata(patch));
                    }
                })
                .mapEmpty();
    }

    private static Map<String, Object> patchMetadata(WorkerPatch patch) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (patch.workerCode() != null) {
            metadata.put("workerCode", patch.workerCode());
        }
        if (patch.fullName() != null) {
            metadata.put("fullName", patch.fullName());
        }
        if (patch.factoryId() != null) {
            metadata.put("factoryId", patch.factoryId());
        }
        if (patch.payout() != null) {
            metadata.put("payout", patch.payout().getValue());
        }
        if (patch.payoutAnchorDate() != null) {
            metadata.put("payoutAnchorDate", patch.payoutAnchorDate().toString());
        }
        if (patch.active() != null) {
            metadata.put("active", patch.active());
        }
        return metadata;
    }

    @Override
    public Future<List<Worker>> listWorkers(boolean includeInactive) {
        return jdbcPool.withConnection(connection -> workerRepository.findAll(includeInactive, connection));
    }

    @Override
    public Future<List<TaskType>> listTaskTypes() {
        return jdbcPool.withConnection(taskTypeRepository::findAll);
    }

    @Override
    public Future<String> upsertRate(String workerId, String taskTypeId, BigDecimal rate, Actor actor) {
        return Future.succeededFuture(rate)
                .map(r -> {
                    authorizationPolicy.requireAdmin(actor, "Setting a worker rate");
                    validator.validateRate(r).throwIfInvalid();
                    return Money.round(r);
                })
                .compose(r -> jdbcPool.withTransaction(connection -> workerRepository.findById(workerId, connection)
                        .compose(found -> Required.present(found, () -> NotFoundException.of("Worker", workerId)))
                        .compose(worker -> taskTypeRepository.findById(taskTypeId, connection))
                        .compose(found -> Required.present(found, () -> NotFoundException.of("Task type", taskTypeId)))
                        .compose(taskType -> workerRateRepository.upsert(WorkerRate.builder()
                                .id(UUID.randomUUID().toString())
                                .workerId(workerId)
                                .taskTypeId(taskTypeId)
                                .rate(r)
                                .build(), connection))))
                .onSuccess(rateId -> {
                    log.info("Rate override {} for worker {} task type {} set to {}", rateId, workerId, taskTypeId, rate);
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("workerId", workerId);
                    metadata.put("taskTypeId", taskTypeId);
                    metadata.put("rate", rate.toPlainString());
                    auditTrail.record(actor, AuditActions.WORKER_RATE_UPSERT, AuditActions.ENTITY_WORKER_RATE, rateId, metadata);
                });
    }

    @Override
    public Future<Void> deleteRate(String rateId, Actor actor) {
        return Future.succeededFuture(rateId)
                .map(id -> {
                    authorizationPolicy.requireAdmin(actor, "Deleting a worker rate");
                    return id;
                })
                .compose(id -> jdbcPool.withTransaction(connection -> workerRateRepository.delete(id, connection)))
                .compose(deleted -> deleted
                        ? Future.<Void>succeededFuture()
                        : Future.<Void>failedFuture(NotFoundException.of("Worker rate", rateId)))
                .onSuccess(v -> auditTrail.record(actor, AuditActions.WORKER_RATE_DELETE, AuditActions.ENTITY_WORKER_RATE,
                        rateId, Map.of()));
    }

    @Override
    public Future<List<WorkerRate>> listRates(String workerId) {
        return jdbcPool.withConnection(connection -> workerRepository.findById(workerId, connection)
                .compose(found -> Required.present(found, () -> NotFoundException.of("Worker", workerId)))
                .compose(worker -> workerRateRepository.findByWorker(workerId, connection)));
    }
}
