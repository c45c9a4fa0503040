package com.fibrepay.domain.model;

import java.time.LocalDate;

/**
 * Inclusive date range a worker is settled over.
 */
public record SettlementPeriod(LocalDate start, LocalDate end) {

    public SettlementPeriod {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Period bounds are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Period end " + end + " is before start " + start);
        }
    }

    /**
     * A period is due for payment once its last day is on or before the given date.
     */
    public boolean hasEndedBy(LocalDate asOf) {
        return !end.isAfter(asOf);
    }
}
