package com.fibrepay.adapter.out.audit;

import com.fibrepay.domain.event.AuditEvent;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.MessageCodec;
import io.vertx.core.json.JsonObject;

import java.time.LocalDateTime;

/**
 * Message codec for AuditEvent to enable event bus communication
 */
public class AuditEventCodec implements MessageCodec<AuditEvent, AuditEvent> {

    public static final String NAME = "AuditEventCodec";

    @Override
    public void encodeToWire(Buffer buffer, AuditEvent event) {
        Buffer json = toJson(event).toBuffer();
        buffer.appendInt(json.length());
        buffer.appendBuffer(json);
    }

    @Override
    public AuditEvent decodeFromWire(int pos, Buffer buffer) {
        int length = buffer.getInt(pos);
        JsonObject json = new JsonObject(buffer.getBuffer(pos + 4, pos + 4 + length));
        return fromJson(json);
    }

    @Override
    public AuditEvent transform(AuditEvent event) {
        return event;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte systemCodecID() {
        return -1;
    }

    static JsonObject toJson(AuditEvent event) {
        return new JsonObject()
                .put("actorId", event.getActorId())
                .put("actorRole", event.getActorRole())
                .put("action", event.getAction())
                .put("entityType", event.getEntityType())
                .put("entityId", event.getEntityId())
                .put("metadata", event.getMetadata() != null ? new JsonObject(event.getMetadata()) : new JsonObject())
                .put("occurredAt", event.getOccurredAt().toString());
    }

    static AuditEvent fromJson(JsonObject json) {
        return new AuditEvent(
                json.getString("actorId"),
                json.getString("actorRole"),
                json.getString("action"),
                json.getString("entityType"),
                json.getString("entityId"),
                json.getJsonObject("metadata").getMap(),
                LocalDateTime.parse(json.getString("occurredAt"))
        );
    }
}
