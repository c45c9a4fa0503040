package com.fibrepay.domain.event;

import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Domain event emitted after a state change that must be auditable
 */
@Value
public class AuditEvent {
    String actorId;
    String actorRole;
    String action;              // e.g. TASK_APPROVE, PAYROLL_RUN_CREATE
    String entityType;          // work_task, work_day, payroll_run, ...
    String entityId;
    Map<String, Object> metadata;
    LocalDateTime occurredAt;
}
