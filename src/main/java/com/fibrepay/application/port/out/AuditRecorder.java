package com.fibrepay.application.port.out;

import com.fibrepay.domain.event.AuditEvent;

/**
 * Output port - receives audit events. Fire-and-forget: implementations must
 * not throw back into the operation that emitted the event.
 */
public interface AuditRecorder {

    void record(AuditEvent event);
}
