package com.fibrepay.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Reference data for a kind of piecework (COMBING, WEAVING, ...)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskType {
    private String id;
    private String code;
    private String name;
    private String unit;
    private TaskCategory category;
    private BigDecimal defaultRate;
}
