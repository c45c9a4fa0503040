package com.fibrepay.adapter.in.web.approval;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * DTO for deciding many tasks with one status
 */
public record BulkDecisionRequest(
        List<String> taskIds,
        String status,
        String reason
) {
    @JsonCreator
    public BulkDecisionRequest(
            @JsonProperty("taskIds") List<String> taskIds,
            @JsonProperty("status") String status,
            @JsonProperty("reason") String reason
    ) {
        this.taskIds = taskIds != null ? taskIds : List.of();
        this.status = status;
        this.reason = reason;
    }
}
