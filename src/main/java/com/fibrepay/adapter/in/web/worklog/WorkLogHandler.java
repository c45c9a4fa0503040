package com.fibrepay.adapter.in.web.worklog;

import com.fibrepay.adapter.in.web.HttpSupport;
import com.fibrepay.application.port.in.WorkLoggingUseCase;
import com.fibrepay.application.port.in.WorkLoggingUseCase.AddTaskCommand;
import com.fibrepay.application.port.in.WorkLoggingUseCase.WorkDayCommand;
import com.fibrepay.domain.model.Actor;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for work days and work tasks
 */
@Slf4j
@RequiredArgsConstructor
public class WorkLogHandler {

    private final WorkLoggingUseCase workLoggingUseCase;

    public void upsertWorkDay(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);
            WorkDayRequest request = HttpSupport.body(context, WorkDayRequest.class);

            WorkDayCommand command = new WorkDayCommand(
                    request.workerId(),
                    request.workDate(),
                    request.workstationId(),
                    request.note()
            );

            workLoggingUseCase.upsertWorkDay(command, actor)
                    .onSuccess(workDayId -> HttpSupport.sendSuccess(context, 200,
                            new JsonObject().put("workDayId", workDayId)))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void workDays(RoutingContext context) {
        try {
            HttpSupport.actor(context);

            workLoggingUseCase.workDays(
                            context.pathParam("workerId"),
                            HttpSupport.queryDate(context, "start"),
                            HttpSupport.queryDate(context, "end"))
                    .onSuccess(days -> HttpSupport.sendSuccess(context, 200, days))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void closeDay(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);
            String workDayId = context.pathParam("workDayId");

            workLoggingUseCase.closeDay(workDayId, actor)
                    .onSuccess(v -> HttpSupport.sendSuccess(context, 200,
                            new JsonObject().put("workDayId", workDayId).put("closed", true)))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void reopenDay(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);
            String workDayId = context.pathParam("workDayId");

            workLoggingUseCase.reopenDay(workDayId, actor)
                    .onSuccess(v -> HttpSupport.sendSuccess(context, 200,
                            new JsonObject().put("workDayId", workDayId).put("closed", false)))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void addTask(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);
            WorkTaskRequest request = HttpSupport.body(context, WorkTaskRequest.class);

            AddTaskCommand command = new AddTaskCommand(
                    request.id(),
                    request.workDayId(),
                    request.taskTypeId(),
                    request.quantity(),
                    request.note()
            );

            workLoggingUseCase.addTask(command, actor)
                    .onSuccess(taskId -> HttpSupport.sendSuccess(context, 201,
                            new JsonObject().put("taskId", taskId)))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void editTask(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);
            String taskId = context.pathParam("taskId");
            WorkTaskPatchRequest request = HttpSupport.body(context, WorkTaskPatchRequest.class);

            workLoggingUseCase.editTask(taskId, request.toPatch(), actor)
                    .onSuccess(v -> HttpSupport.sendSuccess(context, 200, new JsonObject().put("taskId", taskId)))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void deleteTask(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);
            String taskId = context.pathParam("taskId");

            workLoggingUseCase.deleteTask(taskId, actor)
                    .onSuccess(v -> HttpSupport.sendSuccess(context, 200, new JsonObject().put("taskId", taskId)))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }
}
