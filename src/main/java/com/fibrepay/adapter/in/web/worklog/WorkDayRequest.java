package com.fibrepay.adapter.in.web.worklog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * DTO for creating or updating the work day of a worker
 */
public record WorkDayRequest(
        String workerId,
        LocalDate workDate,
        String workstationId,
        String note
) {
    @JsonCreator
    public WorkDayRequest(
            @JsonProperty("workerId") String workerId,
            @JsonProperty("workDate") LocalDate workDate,
            @JsonProperty("workstationId") String workstationId,
            @JsonProperty("note") String note
    ) {
        this.workerId = workerId;
        this.workDate = workDate;
        this.workstationId = workstationId;
        this.note = note;
    }
}
