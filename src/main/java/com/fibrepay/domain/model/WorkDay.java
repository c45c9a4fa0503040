package com.fibrepay.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One record per (worker, calendar date). Closing the day freezes all of its tasks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkDay {
    private String id;
    private String workerId;
    private LocalDate workDate;
    private String loggedBy;
    private String workstationId;
    private String note;
    private boolean closed;
    private String closedBy;
    private LocalDateTime closedAt;
    private LocalDateTime createdAt;
}
