package com.fibrepay.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Settlement snapshot taken as of a date. Items are appended, nothing else changes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayrollRun {
    private String id;
    private LocalDate asOf;
    private String createdBy;
    private String note;
    private LocalDateTime createdAt;
}
