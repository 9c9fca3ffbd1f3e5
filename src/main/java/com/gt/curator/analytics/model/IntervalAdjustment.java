package com.gt.curator.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IntervalAdjustment {
    Shortened("shortened"),
    Standard("standard"),
    Extended("extended");

    private final String label;

    IntervalAdjustment(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
