package com.fibrepay.application.service;

import com.fibrepay.application.port.out.TaskTypeRepository;
import com.fibrepay.application.port.out.WorkerRateRepository;
import com.fibrepay.domain.model.TaskType;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Resolves the pay rate of a worker for a task type: the worker's override
 * when there is one, otherwise the task type's default, otherwise zero.
 */
@Slf4j
@RequiredArgsConstructor
public class RateResolver {

    private final WorkerRateRepository workerRateRepository;
    private final TaskTypeRepository taskTypeRepository;

    public Future<BigDecimal> resolve(String workerId, String taskTypeId, SqlConnection connection) {
        return workerRateRepository.findRate(workerId, taskTypeId, connection)
                .compose(override -> {
                    if (override.isPresent()) {
                        log.debug("Worker {} has rate override {} for task type {}", workerId, override.get(), taskTypeId);
                        return Future.succeededFuture(override.get());
                    }
                    return taskTypeRepository.findById(taskTypeId, connection)
                            .map(taskType -> taskType.map(TaskType::getDefaultRate).orElseGet(() -> {
                                log.warn("Task type {} not found, resolving rate to zero", taskTypeId);
                                return BigDecimal.ZERO;
                            }));
                });
    }
}
