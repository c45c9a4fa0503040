package com.fibrepay.application.service;

import com.fibrepay.application.port.out.AuditRecorder;
import com.fibrepay.domain.event.AuditEvent;
import com.fibrepay.domain.model.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Builds audit events and hands them to the recorder. Best effort: a failing
 * recorder is logged and never undoes the operation that was audited.
 */
@Slf4j
@RequiredArgsConstructor
public class AuditTrail {

    private final AuditRecorder auditRecorder;
    private final Clock clock;

    public void record(Actor actor, String action, String entityType, String entityId, Map<String, Object> metadata) {
        AuditEvent event = new AuditEvent(
                actor.userId(),
                actor.role(),
                action,
                entityType,
                entityId,
                metadata,
                LocalDateTime.now(clock)
        );
        try {
            auditRecorder.record(event);
        } catch (RuntimeException e) {
            log.warn("Audit event {} for {} {} was not recorded: {}", action, entityType, entityId, e.getMessage());
        }
    }
}
