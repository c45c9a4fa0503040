package com.fibrepay.domain.model;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * Partial update of a pending work task. A null field is left unchanged.
 */
@Builder
public record WorkTaskPatch(
        BigDecimal quantity,
        String note,
        String taskTypeId
) {

    public boolean isEmpty() {
        return quantity == null && note == null && taskTypeId == null;
    }
}
