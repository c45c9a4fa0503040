package com.fibrepay.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Worker entity - a person paid per unit of work
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Worker {
    private String id;
    private String workerCode;          // Optional badge / payroll code
    private String fullName;
    private String factoryId;           // Scope used by factory supervisors
    private PayoutFrequency payout;
    private LocalDate payoutAnchorDate; // Defines period boundaries
    private boolean active;             // Workers are deactivated, never deleted
    private LocalDateTime createdAt;
}
