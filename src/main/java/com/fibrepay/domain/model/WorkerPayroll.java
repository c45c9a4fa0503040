package com.fibrepay.domain.model;

/**
 * Approved-but-unpaid totals for one worker over one period
 */
public record WorkerPayroll(
        String workerId,
        String fullName,
        PayoutFrequency payout,
        SettlementPeriod period,
        PayrollTotals totals
) {
}
