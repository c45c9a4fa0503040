package com.fibrepay.adapter.in.web.approval;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fibrepay.domain.exception.ValidationException;
import com.fibrepay.domain.model.TaskStatus;

/**
 * DTO for approving or rejecting one task
 */
public record DecisionRequest(
        String status,
        String reason
) {
    @JsonCreator
    public DecisionRequest(
            @JsonProperty("status") String status,
            @JsonProperty("reason") String reason
    ) {
        this.status = status;
        this.reason = reason;
    }

    static TaskStatus decisionStatus(String status) {
        if (status == null || !TaskStatus.isValid(status) || !TaskStatus.fromValue(status).isDecision()) {
            throw new ValidationException("status must be approved or rejected");
        }
        return TaskStatus.fromValue(status);
    }
}
