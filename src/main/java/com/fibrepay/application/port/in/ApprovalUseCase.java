package com.fibrepay.application.port.in;

import com.fibrepay.application.port.out.WorkTaskRepository.PendingTask;
import com.fibrepay.domain.model.Actor;
import com.fibrepay.domain.model.TaskStatus;
import io.vertx.core.Future;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Inbound port - approval workflow for work tasks
 */
public interface ApprovalUseCase {

    /**
     * Approve or reject a task, settling its pay at the resolved rate
     * @return Future with the settled pay (zero when rejected)
     */
    Future<BigDecimal> decide(DecisionCommand command);

    /**
     * Decide many tasks; tasks that fail a precondition or the authorization
     * check are skipped
     * @return Future with the number of tasks updated
     */
    Future<Integer> bulkDecide(BulkDecisionCommand command);

    /**
     * Pending tasks visible to the actor
     */
    Future<List<PendingTask>> pendingApprovals(PendingFilter filter, Actor actor);

    record DecisionCommand(
            String taskId,
            TaskStatus status,
            String reason,
            Actor decider
    ) {}

    record BulkDecisionCommand(
            List<String> taskIds,
            TaskStatus status,
            String reason,
            Actor decider
    ) {}

    record PendingFilter(
            String workerId,
            LocalDate start,
            LocalDate end
    ) {}
}
