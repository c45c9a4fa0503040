package com.fibrepay.application.port.in;

import com.fibrepay.domain.model.Actor;
import com.fibrepay.domain.model.TaskType;
import com.fibrepay.domain.model.Worker;
import com.fibrepay.domain.model.WorkerPatch;
import com.fibrepay.domain.model.WorkerRate;
import io.vertx.core.Future;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Inbound port - workers, task types and rate overrides
 */
public interface WorkerAdministrationUseCase {

    Future<Worker> createWorker(CreateWorkerCommand command, Actor actor);

    Future<Void> updateWorker(String workerId, WorkerPatch patch, Actor actor);

    Future<List<Worker>> listWorkers(boolean includeInactive);

    Future<List<TaskType>> listTaskTypes();

    Future<String> upsertRate(String workerId, String taskTypeId, BigDecimal rate, Actor actor);

    Future<Void> deleteRate(String rateId, Actor actor);

    Future<List<WorkerRate>> listRates(String workerId);

    record CreateWorkerCommand(
            String workerCode,
            String fullName,
            String factoryId,
            String payout,
            LocalDate payoutAnchorDate
    ) {}
}
