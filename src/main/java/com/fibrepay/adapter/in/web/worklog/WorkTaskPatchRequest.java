package com.fibrepay.adapter.in.web.worklog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fibrepay.domain.model.WorkTaskPatch;

import java.math.BigDecimal;

/**
 * DTO for editing a pending task
 */
public record WorkTaskPatchRequest(
        BigDecimal quantity,
        String note,
        String taskTypeId
) {
    @JsonCreator
    public WorkTaskPatchRequest(
            @JsonProperty("quantity") BigDecimal quantity,
            @JsonProperty("note") String note,
            @JsonProperty("taskTypeId") String taskTypeId
    ) {
        this.quantity = quantity;
        this.note = note;
        this.taskTypeId = taskTypeId;
    }

    public WorkTaskPatch toPatch() {
        return WorkTaskPatch.builder()
                .quantity(quantity)
                .note(note)
                .taskTypeId(taskTypeId)
                .build();
    }
}
