package com.fibrepay.domain.model;

/**
 * Approval status of a work task.
 * PENDING can move to APPROVED or REJECTED; a decided task may be re-decided
 * until a payroll run claims it.
 */
public enum TaskStatus {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Only APPROVED and REJECTED can be requested by a decision.
     */
    public boolean isDecision() {
        return this != PENDING;
    }

    public static TaskStatus fromValue(String value) {
        for (TaskStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }

    public static boolean isValid(String value) {
        for (TaskStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
