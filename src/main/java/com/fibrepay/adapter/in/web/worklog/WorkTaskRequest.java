package com.fibrepay.adapter.in.web.worklog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * DTO for logging a task on a work day. Offline clients send their own id.
 */
public record WorkTaskRequest(
        String id,
        String workDayId,
        String taskTypeId,
        BigDecimal quantity,
        String note
) {
    @JsonCreator
    public WorkTaskRequest(
            @JsonProperty("id") String id,
            @JsonProperty("workDayId") String workDayId,
            @JsonProperty("taskTypeId") String taskTypeId,
            @JsonProperty("quantity") BigDecimal quantity,
            @JsonProperty("note") String note
    ) {
        this.id = id;
        this.workDayId = workDayId;
        this.taskTypeId = taskTypeId;
        this.quantity = quantity;
        this.note = note;
    }
}
