package com.fibrepay.adapter.in.web.worker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fibrepay.application.port.in.WorkerAdministrationUseCase.CreateWorkerCommand;

import java.time.LocalDate;

/**
 * DTO for registering a worker
 */
public record WorkerRequest(
        String workerCode,
        String fullName,
        String factoryId,
        String payout,
        LocalDate payoutAnchorDate
) {
    @JsonCreator
    public WorkerRequest(
            @JsonProperty("workerCode") String workerCode,
            @JsonProperty("fullName") String fullName,
            @JsonProperty("factoryId") String factoryId,
            @JsonProperty("payout") String payout,
            @JsonProperty("payoutAnchorDate") LocalDate payoutAnchorDate
    ) {
        this.workerCode = workerCode;
        this.fullName = fullName;
        this.factoryId = factoryId;
        this.payout = payout;
        this.payoutAnchorDate = payoutAnchorDate;
    }

    public CreateWorkerCommand toCommand() {
        return new CreateWorkerCommand(workerCode, fullName, factoryId, payout, payoutAnchorDate);
    }
}
