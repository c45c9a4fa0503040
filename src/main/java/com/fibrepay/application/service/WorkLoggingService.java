package com.fibrepay.application.service;

import com.fibrepay.application.port.in.WorkLoggingUseCase;
import com.fibrepay.application.port.out.TaskTypeRepository;
import com.fibrepay.application.port.out.WorkDayRepository;
import com.fibrepay.application.port.out.WorkTaskRepository;
import com.fibrepay.application.port.out.WorkerRepository;
import com.fibrepay.domain.event.AuditActions;
import com.fibrepay.domain.exception.ConflictException;
import com.fibrepay.domain.exception.DuplicateEntryException;
import com.fibrepay.domain.exception.NotFoundException;
import com.fibrepay.domain.exception.ValidationException;
import com.fibrepay.domain.model.Actor;
import com.fibrepay.domain.model.Money;
import com.fibrepay.domain.model.PayrollTotals;
import com.fibrepay.domain.model.RubricResult;
import com.fibrepay.domain.model.TaskCategory;
import com.fibrepay.domain.model.TaskStatus;
import com.fibrepay.domain.model.WorkDay;
import com.fibrepay.domain.model.WorkTask;
import com.fibrepay.domain.model.WorkTaskPatch;
import io.vertx.core.Future;
import io.vertx.jdbcclient.JDBCPool;
import io.vertx.sqlclient.SqlConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Application service for logging work days and tasks.
 * A closed day rejects every change to itself and its tasks.
 */
@Slf4j
@RequiredArgsConstructor
public class WorkLoggingService implements WorkLoggingUseCase {

    private final JDBCPool jdbcPool;
    private final WorkerRepository workerRepository;
    private final WorkDayRepository workDayRepository;
    private final WorkTaskRepository workTaskRepository;
    private final TaskTypeRepository taskTypeRepository;
    private final WorkLogValidator validator;
    private final RubricEvaluator rubricEvaluator;
    private final AuthorizationPolicy authorizationPolicy;
    private final AuditTrail auditTrail;
    private final Clock clock;

    @Override
    public Future<String> upsertWorkDay(WorkDayCommand command, Actor actor) {
        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            log.warn("Invalid work day for worker {}: {}", command.workerId(), validation.errors());
            return Future.failedFuture(new ValidationException(validation.errors()));
        }

        // A concurrent upsert of the same (worker, date) makes our insert lose; the retry finds its day
        return retryOnDuplicate(() -> jdbcPool.withTransaction(connection -> workerRepository.findById(command.workerId(), connection)
                        .compose(found -> Required.present(found, () -> NotFoundException.of("Worker", command.workerId())))
                        .compose(worker -> workDayRepository.findByWorkerAndDate(command.workerId(), command.workDate(), connection))
                        .compose(existing -> {
                            if (existing.isPresent()) {
                                return updateDay(existing.get(), command, connection);
                            }
                            return insertDay(command, actor, connection);
                        })))
                .onSuccess(workDayId -> {
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("workerId", command.workerId());
                    metadata.put("workDate", command.workDate().toString());
                    metadata.put("workstationId", command.workstationId());
                    auditTrail.record(actor, AuditActions.WORKDAY_UPSERT, AuditActions.ENTITY_WORK_DAY, workDayId, metadata);
                });
    }

    private Future<String> updateDay(WorkDay workDay, WorkDayCommand command, SqlConnection connection) {
        if (workDay.isClosed()) {
            return Future.failedFuture(new ConflictException("Work day " + workDay.getId() + " is closed"));
        }
        return workDayRepository.updateDetails(workDay.getId(), command.workstationId(), command.note(), connection)
                .map(workDay.getId());
    }

    private Future<String> insertDay(WorkDayCommand command, Actor actor, SqlConnection connection) {
        WorkDay workDay = WorkDay.builder()
                .id(UUID.randomUUID().toString())
                .workerId(command.workerId())
                .workDate(command.workDate())
                .loggedBy(actor.userId())
                .workstationId(command.workstationId())
                .note(command.note())
                .closed(false)
                .createdAt(LocalDateTime.now(clock))
                .build();

        log.info("Opening work day {} for worker {} on {}", workDay.getId(), workDay.getWorkerId(), workDay.getWorkDate());
        return workDayRepository.insert(workDay, connection).map(workDay.getId());
    }

    @Override
    public Future<String> addTask(AddTaskCommand command, Actor actor) {
        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            log.warn("Invalid task for work day {}: {}", command.workDayId(), validation.errors());
            return Future.failedFuture(new ValidationException(validation.errors()));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        WorkTask task = WorkTask.builder()
                .id(command.taskId() != null ? command.taskId() : UUID.randomUUID().toString())
                .workDayId(command.workDayId())
                .taskTypeId(command.taskTypeId())
                .quantity(command.quantity())
                .note(command.note())
                .status(TaskStatus.PENDING)
                .approvedPay(Money.ZERO)
                .updatedBy(actor.userId())
                .updatedAt(now)
                .createdAt(now)
                .build();

        // Replays of one task id may race; the retry sees the committed task and reports it as a replay
        return retryOnDuplicate(() -> jdbcPool.withTransaction(connection -> openDay(command.workDayId(), connection)
                        .compose(workDay -> taskTypeRepository.findById(command.taskTypeId(), connection))
                        .compose(found -> Required.present(found, () -> NotFoundException.of("Task type", command.taskTypeId())))
                        .compose(taskType -> workTaskRepository.insertIfAbsent(task, connection))))
                .map(inserted -> {
                    if (inserted) {
                        Map<String, Object> metadata = new LinkedHashMap<>();
                        metadata.put("workDayId", task.getWorkDayId());
                        metadata.put("taskTypeId", task.getTaskTypeId());
                        metadata.put("quantity", task.getQuantity().toPlainString());
                        auditTrail.record(actor, AuditActions.TASK_CREATE, AuditActions.ENTITY_WORK_TASK, task.getId(), metadata);
                    } else {
                        log.info("Task {} already exists, replay ignored", task.getId());
                    }
                    return task.getId();
                });
    }

    private <T> Future<T> retryOnDuplicate(Supplier<Future<T>> attempt) {
        return attempt.get().recover(error -> {
            if (error instanceof DuplicateEntryException) {
                log.info("Retrying after concurrent insert: {}", error.getMessage());
                return attempt.get();
            }
            return Future.failedFuture(error);
        });
    }

    @Override
    public Future<Void> editTask(String taskId, WorkTaskPatch patch, Actor actor) {
        ValidationResult validation = validator.validate(patch);
        if (!validation.isValid()) {
            return Future.failedFuture(new ValidationException(validation.errors()));
        }

        return jdbcPool.withTransaction(connection -> lockPendingTask(taskId, actor, "edited", connection)
                        .compose(task -> {
                            if (patch.isEmpty()) {
                                return Future.succeededFuture(0);
                            }
                            Future<Void> typeCheck = patch.taskTypeId() == null
                                    ? Future.succeededFuture()
                                    : taskTypeRepository.findById(patch.taskTypeId(), connection)
                                            .compose(found -> Required.present(found,
                                                    () -> NotFoundException.of("Task type", patch.taskTypeId())))
                                            .mapEmpty();
                            return typeCheck.compose(v -> workTaskRepository.applyPatch(
                                    taskId, patch, actor.userId(), LocalDateTime.now(clock), connection));
                        })
                        .compose(updated -> requireChanged(updated, patch.isEmpty(), taskId)))
                .onSuccess(v -> {
                    if (!patch.isEmpty()) {
                        Map<String, Object> metadata = new LinkedHashMap<>();
                        metadata.put("quantity", patch.quantity() != null ? patch.quantity().toPlainString() : null);
                        metadata.put("note", patch.note());
                        metadata.put("taskTypeId", patch.taskTypeId());
                        auditTrail.record(actor, AuditActions.TASK_EDIT, AuditActions.ENTITY_WORK_TASK, taskId, metadata);
                    }
                });
    }

    @Override
    public Future<Void> deleteTask(String taskId, Actor actor) {
        return jdbcPool.withTransaction(connection -> lockPendingTask(taskId, actor, "deleted", connection)
                        .compose(task -> workTaskRepository.deletePending(taskId, connection))
                        .compose(deleted -> requireChanged(deleted, false, taskId)))
                .onSuccess(v -> auditTrail.record(actor, AuditActions.TASK_DELETE, AuditActions.ENTITY_WORK_TASK,
                        taskId, Map.of()));
    }

    @Override
    public Future<Void> closeDay(String workDayId, Actor actor) {
        return jdbcPool.withTransaction(connection -> findDay(workDayId, connection)
                        .compose(workDay -> {
                            if (workDay.isClosed()) {
                                log.debug("Work day {} already closed", workDayId);
                                return Future.succeededFuture(0);
                            }
                            return workDayRepository.close(workDayId, actor.userId(), LocalDateTime.now(clock), connection);
                        }))
                .onSuccess(changed -> {
                    if (changed > 0) {
                        log.info("Work day {} closed by {}", workDayId, actor.userId());
                        auditTrail.record(actor, AuditActions.WORKDAY_CLOSE, AuditActions.ENTITY_WORK_DAY, workDayId, Map.of());
                    }
                })
                .mapEmpty();
    }

    @Override
    public Future<Void> reopenDay(String workDayId, Actor actor) {
        return Future.succeededFuture(actor)
                .map(a -> {
                    authorizationPolicy.requireAdmin(a, "Reopening a work day");
                    return a;
                })
                .compose(a -> jdbcPool.withTransaction(connection -> findDay(workDayId, connection)
                        .compose(workDay -> {
                            if (!workDay.isClosed()) {
                                log.debug("Work day {} already open", workDayId);
                                return Future.succeededFuture(0);
                            }
                            return workDayRepository.reopen(workDayId, connection);
                        })))
                .onSuccess(changed -> {
                    if (changed > 0) {
                        log.info("Work day {} reopened by {}", workDayId, actor.userId());
                        auditTrail.record(actor, AuditActions.WORKDAY_REOPEN, AuditActions.ENTITY_WORK_DAY, workDayId, Map.of());
                    }
                })
                .mapEmpty();
    }

    @Override
    public Future<List<WorkDayView>> workDays(String workerId, LocalDate start, LocalDate end) {
        return jdbcPool.withConnection(connection -> workerRepository.findById(workerId, connection)
                .compose(found -> Required.present(found, () -> NotFoundException.of("Worker", workerId)))
                .compose(worker -> taskTypeRepository.findAll(connection))
                .compose(taskTypes -> workDayRepository.findByWorker(workerId, start, end, connection)
                        .compose(days -> viewsOf(days, PayrollRunService.categoriesOf(taskTypes), connection))));
    }

    private Future<List<WorkDayView>> viewsOf(List<WorkDay> days, Map<String, TaskCategory> categories,
                                              SqlConnection connection) {
        List<WorkDayView> views = new ArrayList<>();

        Future<Void> chain = Future.succeededFuture();
        for (WorkDay day : days) {
            chain = chain.compose(v -> workTaskRepository.findByWorkDay(day.getId(), connection)
                    .map(tasks -> {
                        views.add(new WorkDayView(day, tasks, rubricOf(tasks, categories),
                                rubricOf(approvedOnly(tasks), categories)));
                        return null;
                    }));
        }

        return chain.map(views);
    }

    private RubricResult rubricOf(List<WorkTask> tasks, Map<String, TaskCategory> categories) {
        PayrollTotals totals = PayrollTotals.of(tasks, categories);
        return rubricEvaluator.evaluate(totals.combedKg(), totals.wovenM());
    }

    private static List<WorkTask> approvedOnly(List<WorkTask> tasks) {
        return tasks.stream().filter(WorkTask::isApproved).collect(Collectors.toList());
    }

    private Future<WorkDay> findDay(String workDayId, SqlConnection connection) {
        return workDayRepository.findById(workDayId, connection)
                .compose(found -> Required.present(found, () -> NotFoundException.of("Work day", workDayId)));
    }

    private Future<WorkDay> openDay(String workDayId, SqlConnection connection) {
        return findDay(workDayId, connection)
                .compose(workDay -> workDay.isClosed()
                        ? Future.failedFuture(new ConflictException("Work day " + workDayId + " is closed"))
                        : Future.succeededFuture(workDay));
    }

    /**
     * Lock a task that may still change: its day is open, it is pending and
     * the actor may manage the day
     */
    private Future<WorkTask> lockPendingTask(String taskId, Actor actor, String change, SqlConnection connection) {
        return workTaskRepository.findByIdForUpdate(taskId, connection)
                .compose(found -> Required.present(found, () -> NotFoundException.of("Task", taskId)))
                .compose(task -> openDay(task.getWorkDayId(), connection)
                        .map(workDay -> {
                            if (!task.isPending() || task.isPaid()) {
                                throw new ConflictException("Only pending tasks can be " + change
                                        + ", task " + taskId + " is " + task.getStatus().getValue());
                            }
                            authorizationPolicy.requireDayAccess(actor, workDay);
                            return task;
                        }));
    }

    private Future<Void> requireChanged(int rows, boolean noChangeExpected, String taskId) {
        if (rows == 0 && !noChangeExpected) {
            return Future.failedFuture(new ConflictException("Task " + taskId + " changed concurrently"));
        }
        return Future.succeededFuture();
    }
}
