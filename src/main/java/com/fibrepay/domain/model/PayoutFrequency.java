package com.fibrepay.domain.model;

/**
 * How often a worker is settled. Weekly and biweekly cycles are fixed-length
 * blocks tiled from the worker's anchor date; monthly cycles follow the
 * anchor's day-of-month.
 */
public enum PayoutFrequency {
    WEEKLY("weekly", 7),
    BIWEEKLY("biweekly", 14),
    MONTHLY("monthly", 0);

    private final String value;
    private final int blockDays;

    PayoutFrequency(String value, int blockDays) {
        this.value = value;
        this.blockDays = blockDays;
    }

    public String getValue() {
        return value;
    }

    /**
     * Length of a fixed block in days, 0 for calendar-based cycles.
     */
    public int getBlockDays() {
        return blockDays;
    }

    public boolean isFixedBlock() {
        return blockDays > 0;
    }

    public static PayoutFrequency fromValue(String value) {
        for (PayoutFrequency frequency : values()) {
            if (frequency.value.equalsIgnoreCase(value)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("Unknown payout frequency: " + value);
    }

    public static boolean isValid(String value) {
        for (PayoutFrequency frequency : values()) {
            if (frequency.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
