package com.fibrepay.adapter.in.web.approval;

import com.fibrepay.adapter.in.web.HttpSupport;
import com.fibrepay.application.port.in.ApprovalUseCase;
import com.fibrepay.application.port.in.ApprovalUseCase.BulkDecisionCommand;
import com.fibrepay.application.port.in.ApprovalUseCase.DecisionCommand;
import com.fibrepay.application.port.in.ApprovalUseCase.PendingFilter;
import com.fibrepay.domain.model.Actor;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for the approval workflow
 * Handles POST /api/work-tasks/:taskId/decide, POST /api/work-tasks/bulk-decide
 * and GET /api/approvals/pending
 */
@Slf4j
@RequiredArgsConstructor
public class ApprovalHandler {

    private final ApprovalUseCase approvalUseCase;

    public void decide(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);
            String taskId = context.pathParam("taskId");
            DecisionRequest request = HttpSupport.body(context, DecisionRequest.class);

            DecisionCommand command = new DecisionCommand(
                    taskId,
                    DecisionRequest.decisionStatus(request.status()),
                    request.reason(),
                    actor
            );

            approvalUseCase.decide(command)
                    .onSuccess(pay -> HttpSupport.sendSuccess(context, 200, new JsonObject()
                            .put("taskId", taskId)
                            .put("status", command.status().getValue())
                            .put("approvedPay", pay)))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void bulkDecide(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);
            BulkDecisionRequest request = HttpSupport.body(context, BulkDecisionRequest.class);

            BulkDecisionCommand command = new BulkDecisionCommand(
                    request.taskIds(),
                    DecisionRequest.decisionStatus(request.status()),
                    request.reason(),
                    actor
            );

            approvalUseCase.bulkDecide(command)
                    .onSuccess(updated -> HttpSupport.sendSuccess(context, 200, new JsonObject()
                            .put("requested", request.taskIds().size())
                            .put("updated", updated)))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }

    public void pending(RoutingContext context) {
        try {
            Actor actor = HttpSupport.actor(context);
            PendingFilter filter = new PendingFilter(
                    HttpSupport.queryString(context, "worker_id"),
                    HttpSupport.queryDate(context, "start"),
                    HttpSupport.queryDate(context, "end")
            );

            approvalUseCase.pendingApprovals(filter, actor)
                    .onSuccess(tasks -> HttpSupport.sendSuccess(context, 200, tasks))
                    .onFailure(error -> HttpSupport.sendError(context, error));
        } catch (RuntimeException e) {
            HttpSupport.sendError(context, e);
        }
    }
}
