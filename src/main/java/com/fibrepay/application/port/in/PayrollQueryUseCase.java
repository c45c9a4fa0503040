package com.fibrepay.application.port.in;

import com.fibrepay.domain.model.Actor;
import com.fibrepay.domain.model.WorkerPayroll;
import io.vertx.core.Future;

import java.time.LocalDate;
import java.util.List;

/**
 * Inbound port - read-only payroll views
 */
public interface PayrollQueryUseCase {

    /**
     * Approved, unpaid totals of one worker for the period so far
     */
    Future<WorkerPayroll> workerPayroll(String workerId, LocalDate asOf);

    /**
     * Workers whose settlement period ended on or before asOf and who have a
     * positive approved, unpaid total - what a run would pay out
     */
    Future<List<WorkerPayroll>> payrollDue(LocalDate asOf, Actor actor);
}
