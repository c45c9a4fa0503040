package com.fibrepay.domain.model;

/**
 * Groups task types for payroll totals and the daily rubric.
 * COMBING is measured in kilograms, WEAVING in metres.
 */
public enum TaskCategory {
    COMBING("COMBING"),
    WEAVING("WEAVING"),
    OTHER("OTHER");

    private final String value;

    TaskCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TaskCategory fromValue(String value) {
        for (TaskCategory category : values()) {
            if (category.value.equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown task category: " + value);
    }
}
