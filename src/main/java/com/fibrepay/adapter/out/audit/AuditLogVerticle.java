package com.fibrepay.adapter.out.audit;

import com.fibrepay.domain.event.AuditEvent;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.MessageConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every audit event as one JSON line to the AUDIT logger.
 * Consumes on a single event-loop, so lines keep publication order.
 */
public class AuditLogVerticle extends AbstractVerticle {
    private static final Logger log = LoggerFactory.getLogger(AuditLogVerticle.class);
    private static final Logger audit = LoggerFactory.getLogger("AUDIT");

    private MessageConsumer<AuditEvent> consumer;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting Audit Log Verticle...");

        consumer = vertx.eventBus().consumer(EventBusAuditRecorder.AUDIT_EVENT_ADDRESS, message -> {
            AuditEvent event = message.body();
            audit.info(AuditEventCodec.toJson(event).encode());
        });

        consumer.completionHandler(ar -> {
            if (ar.succeeded()) {
                log.info("Audit Log Verticle listening on {}", EventBusAuditRecorder.AUDIT_EVENT_ADDRESS);
                startPromise.complete();
            } else {
                startPromise.fail(ar.cause());
            }
        });
    }

    @Override
    public void stop() {
        if (consumer != null) {
            consumer.unregister();
        }
    }
}
