package com.fibrepay.domain.event;

/**
 * Action and entity names used in audit events
 */
public final class AuditActions {

    public static final String WORKER_CREATE = "WORKER_CREATE";
    public static final String WORKER_UPDATE = "WORKER_UPDATE";
    public static final String WORKER_RATE_UPSERT = "WORKER_RATE_UPSERT";
    public static final String WORKER_RATE_DELETE = "WORKER_RATE_DELETE";
    public static final String WORKDAY_UPSERT = "WORKDAY_UPSERT";
    public static final String WORKDAY_CLOSE = "WORKDAY_CLOSE";
    public static final String WORKDAY_REOPEN = "WORKDAY_REOPEN";
    public static final String TASK_CREATE = "TASK_CREATE";
    public static final String TASK_EDIT = "TASK_EDIT";
    public static final String TASK_DELETE = "TASK_DELETE";
    public static final String TASK_APPROVE = "TASK_APPROVE";
    public static final String TASK_REJECT = "TASK_REJECT";
    public static final String PAYROLL_RUN_CREATE = "PAYROLL_RUN_CREATE";

    public static final String ENTITY_WORKER = "worker";
    public static final String ENTITY_WORKER_RATE = "worker_rate";
    public static final String ENTITY_WORK_DAY = "work_day";
    public static final String ENTITY_WORK_TASK = "work_task";
    public static final String ENTITY_PAYROLL_RUN = "payroll_run";

    private AuditActions() {
    }
}
