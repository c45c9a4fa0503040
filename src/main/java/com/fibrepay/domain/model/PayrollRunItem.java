package com.fibrepay.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One row per worker per run: the period and totals paid by that run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayrollRunItem {
    private String runId;
    private String workerId;
    private String workerName;
    private PayoutFrequency payout;
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private BigDecimal approvedTotalPay;
    private BigDecimal approvedCombedKg;
    private BigDecimal approvedWovenM;
    private int taskCount;
}
