package com.fibrepay.support;

import com.fibrepay.adapter.out.persistence.JdbcPayrollRunPersistenceAdapter;
import com.fibrepay.adapter.out.persistence.JdbcTaskTypePersistenceAdapter;
import com.fibrepay.adapter.out.persistence.JdbcWorkDayPersistenceAdapter;
import com.fibrepay.adapter.out.persistence.JdbcWorkTaskPersistenceAdapter;
import com.fibrepay.adapter.out.persistence.JdbcWorkerPersistenceAdapter;
import com.fibrepay.adapter.out.persistence.JdbcWorkerRatePersistenceAdapter;
import com.fibrepay.application.port.in.ApprovalUseCase.DecisionCommand;
import com.fibrepay.application.port.in.WorkLoggingUseCase.AddTaskCommand;
import com.fibrepay.application.port.in.WorkLoggingUseCase.WorkDayCommand;
import com.fibrepay.application.port.in.WorkerAdministrationUseCase.CreateWorkerCommand;
import com.fibrepay.application.service.ApprovalService;
import com.fibrepay.application.service.AuditTrail;
import com.fibrepay.application.service.AuthorizationPolicy;
import com.fibrepay.application.service.PayrollQueryService;
import com.fibrepay.application.service.PayrollRunService;
import com.fibrepay.application.service.PeriodCalculator;
import com.fibrepay.application.service.RateResolver;
import com.fibrepay.application.service.RubricEvaluator;
import com.fibrepay.application.service.WorkLogValidator;
import com.fibrepay.application.service.WorkLoggingService;
import com.fibrepay.application.service.WorkerAdministrationService;
import com.fibrepay.domain.model.Actor;
import com.fibrepay.domain.model.TaskStatus;
import com.fibrepay.domain.model.WorkTask;
import com.fibrepay.domain.model.Worker;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static com.fibrepay.support.TestDatabase.await;

/**
 * Real services over a private H2 database, plus shortcuts for arranging work
 */
public class PieceworkFixture implements AutoCloseable {

    public static final String COMBING = "tt-combing";
    public static final String WEAVING = "tt-weaving";
    public static final String TWISTING = "tt-twisting";

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);

    public static final Actor ADMIN = new Actor.Admin("admin-1");
    public static final Actor SUPERVISOR = new Actor.Supervisor("sup-1", null);
    public static final Actor OTHER_SUPERVISOR = new Actor.Supervisor("sup-2", null);

    public final TestDatabase db;
    public final RecordingAuditRecorder audit = new RecordingAuditRecorder();

    public final JdbcWorkTaskPersistenceAdapter workTasks = new JdbcWorkTaskPersistenceAdapter();
    public final JdbcWorkDayPersistenceAdapter workDays = new JdbcWorkDayPersistenceAdapter();

    public final ApprovalService approvals;
    public final PayrollRunService payrollRuns;
    public final PayrollQueryService payrollQueries;
    public final WorkLoggingService workLogging;
    public final WorkerAdministrationService workerAdministration;

    public PieceworkFixture() {
        db = TestDatabase.create();

        JdbcWorkerPersistenceAdapter workers = new JdbcWorkerPersistenceAdapter();
        JdbcTaskTypePersistenceAdapter taskTypes = new JdbcTaskTypePersistenceAdapter();
        JdbcWorkerRatePersistenceAdapter workerRates = new JdbcWorkerRatePersistenceAdapter();
        JdbcPayrollRunPersistenceAdapter payrollRunRepository = new JdbcPayrollRunPersistenceAdapter();

        AuditTrail auditTrail = new AuditTrail(audit, CLOCK);
        AuthorizationPolicy policy = new AuthorizationPolicy();
        PeriodCalculator periods = new PeriodCalculator();
        WorkLogValidator validator = new WorkLogValidator();

        approvals = new ApprovalService(db.pool(), workTasks, workDays,
                new RateResolver(workerRates, taskTypes), policy, auditTrail, CLOCK);
        payrollRuns = new PayrollRunService(db.pool(), workers, taskTypes, workTasks, payrollRunRepository,
                periods, auditTrail, CLOCK);
        payrollQueries = new PayrollQueryService(db.pool(), workers, taskTypes, workTasks, periods, policy, CLOCK);
        workLogging = new WorkLoggingService(db.pool(), workers, workDays, workTasks, taskTypes, validator,
                new RubricEvaluator(), policy, auditTrail, CLOCK);
        workerAdministration = new WorkerAdministrationService(db.pool(), workers, taskTypes, workerRates,
                validator, policy, auditTrail, CLOCK);
    }

    public Worker worker(String fullName, String payout, LocalDate anchor) {
        return worker(fullName, payout, anchor, null);
    }

    public Worker worker(String fullName, String payout, LocalDate anchor, String factoryId) {
        return await(workerAdministration.createWorker(
                new CreateWorkerCommand(null, fullName, factoryId, payout, anchor), ADMIN));
    }

    public String day(String workerId, LocalDate date) {
        return day(workerId, date, SUPERVISOR);
    }

    public String day(String workerId, LocalDate date, Actor loggedBy) {
        return await(workLogging.upsertWorkDay(new WorkDayCommand(workerId, date, null, null), loggedBy));
    }

    public String task(String workDayId, String taskTypeId, String quantity) {
        return await(workLogging.addTask(
                new AddTaskCommand(null, workDayId, taskTypeId, new BigDecimal(quantity), null), SUPERVISOR));
    }

    public BigDecimal approve(String taskId) {
        return await(approvals.decide(new DecisionCommand(taskId, TaskStatus.APPROVED, null, ADMIN)));
    }

    public String approvedTask(String workDayId, String taskTypeId, String quantity) {
        String taskId = task(workDayId, taskTypeId, quantity);
        approve(taskId);
        return taskId;
    }

    public WorkTask load(String taskId) {
        Optional<WorkTask> task = await(db.pool().withConnection(connection -> workTasks.findById(taskId, connection)));
        return task.orElseThrow(() -> new AssertionError("Task not found: " + taskId));
    }

    @Override
    public void close() {
        db.close();
    }
}
