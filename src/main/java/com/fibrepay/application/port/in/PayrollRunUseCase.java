package com.fibrepay.application.port.in;

import com.fibrepay.domain.model.Actor;
import com.fibrepay.domain.model.PayrollRun;
import com.fibrepay.domain.model.PayrollRunItem;
import io.vertx.core.Future;

import java.time.LocalDate;
import java.util.List;

/**
 * Inbound port - settlement of approved work into payroll runs
 */
public interface PayrollRunUseCase {

    /**
     * Settle every active worker's approved, unpaid work in the period containing asOf
     * @return Future with the new run id
     */
    Future<String> createRun(CreateRunCommand command);

    Future<RunDetails> findRun(String runId);

    Future<List<PayrollRun>> listRuns(int limit);

    record CreateRunCommand(
            LocalDate asOf,
            String note,
            Actor creator
    ) {}

    record RunDetails(
            PayrollRun run,
            List<PayrollRunItem> items
    ) {}
}
