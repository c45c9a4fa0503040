package com.fibrepay.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Outcome of an approval decision as written to the task row
 */
public record TaskDecision(
        String taskId,
        TaskStatus status,
        String decidedBy,
        LocalDateTime decidedAt,
        String reason,
        BigDecimal approvedPay
) {
}
