package com.gt.curator.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressTrend {
    Improving("improving"),
    Declining("declining"),
    Stable("stable");

    private final String label;

    ProgressTrend(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
