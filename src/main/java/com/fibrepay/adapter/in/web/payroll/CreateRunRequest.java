package com.fibrepay.adapter.in.web.payroll;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * DTO for starting a payroll run. A missing asOf means today.
 */
public record CreateRunRequest(
        LocalDate asOf,
        String note
) {
    @JsonCreator
    public CreateRunRequest(
            @JsonProperty("asOf") LocalDate asOf,
            @JsonProperty("note") String note
    ) {
        this.asOf = asOf;
        this.note = note;
    }
}
