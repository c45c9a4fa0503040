package com.fibrepay.support;

import com.fibrepay.application.port.out.AuditRecorder;
import com.fibrepay.domain.event.AuditEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Keeps audit events in memory for assertions
 */
public class RecordingAuditRecorder implements AuditRecorder {

    private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void record(AuditEvent event) {
        events.add(event);
    }

    public List<AuditEvent> events() {
        return events;
    }

    public List<String> actions() {
        return events.stream().map(AuditEvent::getAction).collect(Collectors.toList());
    }
}
