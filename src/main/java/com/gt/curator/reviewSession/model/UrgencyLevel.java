package com.gt.curator.reviewSession.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UrgencyLevel {
    New("new"),
    DueToday("due_today"),
    Overdue("overdue"),
    VeryOverdue("very_overdue");

    static final int VERY_OVERDUE_AFTER_DAYS = 3;

    private final String label;

    UrgencyLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static UrgencyLevel fromDaysOverdue(long daysOverdue) {
        if (daysOverdue <= 0) {
            return DueToday;
        } else if (daysOverdue <= VERY_OVERDUE_AFTER_DAYS) {
            return Overdue;
        }

        return VeryOverdue;
    }
}
