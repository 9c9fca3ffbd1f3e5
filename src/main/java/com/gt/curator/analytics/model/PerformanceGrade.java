package com.gt.curator.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PerformanceGrade {
    APlus("A+", 0.9),
    A("A", 0.8),
    B("B", 0.7),
    C("C", 0.6),
    D("D", Double.NEGATIVE_INFINITY);

    private final String label;
    private final double minScore;

    PerformanceGrade(String label, double minScore) {
        this.label = label;
        this.minScore = minScore;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static PerformanceGrade fromScore(double score) {
        for (PerformanceGrade grade : values()) {
            if (score >= grade.minScore) {
                return grade;
            }
        }

        return D;
    }
}
