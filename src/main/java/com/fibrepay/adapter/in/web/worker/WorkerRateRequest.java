package com.fibrepay.adapter.in.web.worker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * DTO for setting a worker's rate override on a task type
 */
public record WorkerRateRequest(
        String workerId,
        String taskTypeId,
        BigDecimal rate
) {
    @JsonCreator
    public WorkerRateRequest(
            @JsonProperty("workerId") String workerId,
            @JsonProperty("taskTypeId") String taskTypeId,
            @JsonProperty("rate") BigDecimal rate
    ) {
        this.workerId = workerId;
        this.taskTypeId = taskTypeId;
        this.rate = rate;
    }
}
