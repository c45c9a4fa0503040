package com.fibrepay.domain.model;

import lombok.Builder;

import java.time.LocalDate;

/**
 * Partial update of a worker. A null field is left unchanged.
 */
@Builder
public record WorkerPatch(
        String workerCode,
        String fullName,
        String factoryId,
        PayoutFrequency payout,
        LocalDate payoutAnchorDate,
        Boolean active
) {

    public boolean isEmpty() {
        return workerCode == null && fullName == null && factoryId == null
                && payout == null && payoutAnchorDate == null && active == null;
    }
}
