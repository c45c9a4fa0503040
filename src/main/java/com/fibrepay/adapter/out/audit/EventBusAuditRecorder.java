package com.fibrepay.adapter.out.audit;

import com.fibrepay.application.port.out.AuditRecorder;
import com.fibrepay.domain.event.AuditEvent;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes audit events to the Vert.x event bus, where AuditLogVerticle picks them up
 */
public class EventBusAuditRecorder implements AuditRecorder {
    private static final Logger log = LoggerFactory.getLogger(EventBusAuditRecorder.class);

    public static final String AUDIT_EVENT_ADDRESS = "audit.events";

    private final Vertx vertx;

    public EventBusAuditRecorder(Vertx vertx) {
        this.vertx = vertx;
    }

    @Override
    public void record(AuditEvent event) {
        log.debug("Publishing audit event {} for {} {}", event.getAction(), event.getEntityType(), event.getEntityId());
        try {
            vertx.eventBus().publish(AUDIT_EVENT_ADDRESS, event);
        } catch (RuntimeException e) {
            log.warn("Failed to publish audit event {} for {} {}: {}",
                    event.getAction(), event.getEntityType(), event.getEntityId(), e.getMessage());
        }
    }
}
