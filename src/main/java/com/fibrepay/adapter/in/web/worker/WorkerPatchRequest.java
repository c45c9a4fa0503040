package com.fibrepay.adapter.in.web.worker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fibrepay.domain.exception.ValidationException;
import com.fibrepay.domain.model.PayoutFrequency;
import com.fibrepay.domain.model.WorkerPatch;

import java.time.LocalDate;

/**
 * DTO for a partial worker update. Absent fields stay unchanged.
 */
public record WorkerPatchRequest(
        String workerCode,
        String fullName,
        String factoryId,
        String payout,
        LocalDate payoutAnchorDate,
        Boolean active
) {
    @JsonCreator
    public WorkerPatchRequest(
            @JsonProperty("workerCode") String workerCode,
            @JsonProperty("fullName") String fullName,
            @JsonProperty("factoryId") String factoryId,
            @JsonProperty("payout") String payout,
            @JsonProperty("payoutAnchorDate") LocalDate payoutAnchorDate,
            @JsonProperty("active") Boolean active
    ) {
        this.workerCode = workerCode;
        this.fullName = fullName;
        this.factoryId = factoryId;
        this.payout = payout;
        this.payoutAnchorDate = payoutAnchorDate;
        this.active = active;
    }

    public WorkerPatch toPatch() {
        if (payout != null && !PayoutFrequency.isValid(payout)) {
            throw new ValidationException("payout must be one of weekly, biweekly, monthly");
        }
        return WorkerPatch.builder()
                .workerCode(workerCode)
                .fullName(fullName)
                .factoryId(factoryId)
                .payout(payout != null ? PayoutFrequency.fromValue(payout) : null)
                .payoutAnchorDate(payoutAnchorDate)
                .active(active)
                .build();
    }
}
