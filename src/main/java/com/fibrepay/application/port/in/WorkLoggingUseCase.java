package com.fibrepay.application.port.in;

import com.fibrepay.domain.model.Actor;
import com.fibrepay.domain.model.RubricResult;
import com.fibrepay.domain.model.WorkDay;
import com.fibrepay.domain.model.WorkTask;
import com.fibrepay.domain.model.WorkTaskPatch;
import io.vertx.core.Future;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Inbound port - logging of work days and tasks
 */
public interface WorkLoggingUseCase {

    /**
     * Create the day for (worker, date) or update the details of the existing open day
     * @return Future with the work day id
     */
    Future<String> upsertWorkDay(WorkDayCommand command, Actor actor);

    /**
     * @return Future with the task id, generated when the command carries none
     */
    Future<String> addTask(AddTaskCommand command, Actor actor);

    Future<Void> editTask(String taskId, WorkTaskPatch patch, Actor actor);

    Future<Void> deleteTask(String taskId, Actor actor);

    Future<Void> closeDay(String workDayId, Actor actor);

    Future<Void> reopenDay(String workDayId, Actor actor);

    Future<List<WorkDayView>> workDays(String workerId, LocalDate start, LocalDate end);

    record WorkDayCommand(
            String workerId,
            LocalDate workDate,
            String workstationId,
            String note
    ) {}

    record AddTaskCommand(
            String taskId,
            String workDayId,
            String taskTypeId,
            BigDecimal quantity,
            String note
    ) {}

    /**
     * A day with its tasks; the logged rubric counts every task, the approved
     * rubric only approved ones
     */
    record WorkDayView(
            WorkDay workDay,
            List<WorkTask> tasks,
            RubricResult rubricLogged,
            RubricResult rubricApproved
    ) {}
}
