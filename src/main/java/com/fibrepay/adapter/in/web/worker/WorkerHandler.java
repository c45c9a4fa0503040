package com.fibrepay.adapter.in.web.worker;

import com.fibrepay.adapter.in.web.HttpSupport;
import com.fibrepay.application.port.in.WorkerAdministrationUseCase;
import com.fibrepay.domain.exception.ValidationException;
import com.fibrepay.domain.model.Actor;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for workers, task types and rate overrides
 */
@Slf4j
@RequiredArgsConstructor
public class WorkerHandler {

    private final WorkerAdministrationUseCase workerAdministrationUseCase;

    public void listWorkers(RoutingContext context) {
        try {
            HttpSupport.actor(context);
            boolean includeInactive = Boolean.parseBoolean(context.queryParams().get("include_inactive"));

            workerAdministrationUseCase.listWorkers(includeInactive)
                    .onSuccess(workers -> HttpSupport.sendSuccess(context, 200, workers))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void createWorker(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);
            WorkerRequest request = HttpSupport.body(context, WorkerRequest.class);

            workerAdministrationUseCase.createWorker(request.toCommand(), actor)
                    .onSuccess(worker -> HttpSupport.sendSuccess(context, 201, worker))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void updateWorker(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);
            String workerId = context.pathParam("workerId");
            WorkerPatchRequest request = HttpSupport.body(context, WorkerPatchRequest.class);

            workerAdministrationUseCase.updateWorker(workerId, request.toPatch(), actor)
                    .onSuccess(v -> HttpSupport.sendSuccess(context, 200, new JsonObject().put("workerId", workerId)))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void listTaskTypes(RoutingContext context) {
        try {
            HttpSupport.actor(context);

            workerAdministrationUseCase.listTaskTypes()
                    .onSuccess(taskTypes -> HttpSupport.sendSuccess(context, 200, taskTypes))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void listRates(RoutingContext context) {
        try {
            HttpSupport.actor(context);

            workerAdministrationUseCase.listRates(context.pathParam("workerId"))
                    .onSuccess(rates -> HttpSupport.sendSuccess(context, 200, rates))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void upsertRate(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);
            WorkerRateRequest request = HttpSupport.body(context, WorkerRateRequest.class);
            if (request.workerId() == null || request.taskTypeId() == null) {
                throw new ValidationException("workerId and taskTypeId are required");
            }

            workerAdministrationUseCase.upsertRate(request.workerId(), request.taskTypeId(), request.rate(), actor)
                    .onSuccess(rateId -> HttpSupport.sendSuccess(context, 200, new JsonObject().put("rateId", rateId)))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void deleteRate(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);
            String rateId = context.pathParam("rateId");

            workerAdministrationUseCase.deleteRate(rateId, actor)
                    .onSuccess(v -> HttpSupport.sendSuccess(context, 200, new JsonObject().put("rateId", rateId)))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }
}
