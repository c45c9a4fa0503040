package com.fibrepay.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * WorkTask entity - a quantified, priced unit of piecework subject to approval
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkTask {
    private String id;                  // May be generated by the client for offline replay
    private String workDayId;
    private String taskTypeId;
    private BigDecimal quantity;
    private String note;
    private TaskStatus status;
    private String decidedBy;
    private LocalDateTime decidedAt;
    private String decisionReason;
    private BigDecimal approvedPay;     // Settled at decision time, zero unless approved
    private String paidRunId;           // Set once by the payroll run that paid this task
    private LocalDateTime paidAt;
    private String updatedBy;
    private LocalDateTime updatedAt;
    private LocalDateTime createdAt;

    public boolean isPaid() {
        return paidRunId != null;
    }

    public boolean isPending() {
        return TaskStatus.PENDING.equals(status);
    }

    public boolean isApproved() {
        return TaskStatus.APPROVED.equals(status);
    }
}
