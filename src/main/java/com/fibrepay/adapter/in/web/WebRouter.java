package com.fibrepay.adapter.in.web;

import com.fibrepay.adapter.in.web.approval.ApprovalHandler;
import com.fibrepay.adapter.in.web.payroll.PayrollHandler;
import com.fibrepay.adapter.in.web.worker.WorkerHandler;
import com.fibrepay.adapter.in.web.worklog.WorkLogHandler;
import io.vertx.ext.web.Router;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for the piecework endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    private final Router router;
    private final WorkerHandler workerHandler;
    private final WorkLogHandler workLogHandler;
    private final ApprovalHandler approvalHandler;
    private final PayrollHandler payrollHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, PATCH, DELETE, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers",
                            "Content-Type, X-User-Id, X-User-Role, X-Factory-Id, X-Requested-With");
            ctx.next();
        });

        // Handle OPTIONS preflight requests
        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        // Workers, task types and rates
        router.get("/api/task-types").handler(workerHandler::listTaskTypes);
        router.get("/api/workers").handler(workerHandler::listWorkers);
        router.post("/api/workers").handler(workerHandler::createWorker);
        router.patch("/api/workers/:workerId").handler(workerHandler::updateWorker);
        router.get("/api/worker-rates/:workerId").handler(workerHandler::listRates);
        router.post("/api/worker-rates").handler(workerHandler::upsertRate);
        router.delete("/api/worker-rates/:rateId").handler(workerHandler::deleteRate);

        // Work days and tasks
        router.post("/api/work-days").handler(workLogHandler::upsertWorkDay);
        router.get("/api/work-days/:workerId").handler(workLogHandler::workDays);
        router.post("/api/work-days/:workDayId/close").handler(workLogHandler::closeDay);
        router.post("/api/work-days/:workDayId/reopen").handler(workLogHandler::reopenDay);
        router.post("/api/work-tasks").handler(workLogHandler::addTask);
        router.post("/api/work-tasks/bulk-decide").handler(approvalHandler::bulkDecide);
        router.patch("/api/work-tasks/:taskId").handler(workLogHandler::editTask);
        router.delete("/api/work-tasks/:taskId").handler(workLogHandler::deleteTask);

        // Approvals
        router.get("/api/approvals/pending").handler(approvalHandler::pending);
        router.post("/api/work-tasks/:taskId/decide").handler(approvalHandler::decide);

        // Payroll; /due must precede /:workerId
        router.get("/api/payroll/due").handler(payrollHandler::payrollDue);
        router.get("/api/payroll/:workerId").handler(payrollHandler::workerPayroll);
        router.post("/api/payroll-runs").handler(payrollHandler::createRun);
        router.get("/api/payroll-runs").handler(payrollHandler::listRuns);
        router.get("/api/payroll-runs/:runId").handler(payrollHandler::findRun);

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"status\":\"UP\",\"service\":\"piecework-settlement\"}");
                });
    }
}
