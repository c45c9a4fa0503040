package com.fibrepay.adapter.in.web.payroll;

import com.fibrepay.adapter.in.web.HttpSupport;
import com.fibrepay.application.port.in.PayrollQueryUseCase;
import com.fibrepay.application.port.in.PayrollRunUseCase;
import com.fibrepay.application.port.in.PayrollRunUseCase.CreateRunCommand;
import com.fibrepay.domain.model.Actor;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;

/**
 * HTTP handler for payroll previews and payroll runs
 */
@Slf4j
@RequiredArgsConstructor
public class PayrollHandler {

    private static final int DEFAULT_RUN_LIMIT = 50;

    private final PayrollQueryUseCase payrollQueryUseCase;
    private final PayrollRunUseCase payrollRunUseCase;
    private final Clock clock;

    public void workerPayroll(RoutingContext context) {
        try {
            HttpSupport.actor(context);
            String workerId = context.pathParam("workerId");

            payrollQueryUseCase.workerPayroll(workerId, HttpSupport.queryDate(context, "as_of"))
                    .onSuccess(payroll -> HttpSupport.sendSuccess(context, 200, payroll))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void payrollDue(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);

            payrollQueryUseCase.payrollDue(HttpSupport.queryDate(context, "as_of"), actor)
                    .onSuccess(due -> HttpSupport.sendSuccess(context, 200, due))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void createRun(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);
            CreateRunRequest request = HttpSupport.body(context, CreateRunRequest.class);
            LocalDate asOf = request.asOf() != null ? request.asOf() : LocalDate.now(clock);

            log.info("Payroll run requested by {} as of {}", actor.userId(), asOf);

            payrollRunUseCase.createRun(new CreateRunCommand(asOf, request.note(), actor))
                    .onSuccess(runId -> HttpSupport.sendSuccess(context, 201, new JsonObject()
                            .put("runId", runId)
                            .put("asOf", asOf.toString())))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void listRuns(RoutingContext context) {
        try {
            HttpSupport.actor(context);

            payrollRunUseCase.listRuns(HttpSupport.queryInt(context, "limit", DEFAULT_RUN_LIMIT))
                    .onSuccess(runs -> HttpSupport.sendSuccess(context, 200, runs))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void findRun(RoutingContext context) {
        try {
            HttpSupport.actor(context);

            payrollRunUseCase.findRun(context.pathParam("runId"))
                    .onSuccess(details -> HttpSupport.sendSuccess(context, 200, details))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }
}
