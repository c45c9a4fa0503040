package com.fibrepay.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Worker-specific override of a task type's default rate.
 * At most one per (worker, task type).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerRate {
    private String id;
    private String workerId;
    private String taskTypeId;
    private BigDecimal rate;
}
