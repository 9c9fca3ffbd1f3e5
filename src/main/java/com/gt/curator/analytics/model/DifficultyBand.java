package com.gt.curator.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

// Bands by ease factor, upper bound exclusive
public enum DifficultyBand {
    VeryHard("very_hard", 1.5),
    Hard("hard", 2.0),
    Medium("medium", 2.3),
    Easy("easy", Double.MAX_VALUE);

    private final String label;
    private final double maxEaseFactor;

    DifficultyBand(String label, double maxEaseFactor) {
        this.label = label;
        this.maxEaseFactor = maxEaseFactor;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static DifficultyBand fromEaseFactor(double easeFactor) {
        for (DifficultyBand band : values()) {
            if (easeFactor < band.maxEaseFactor) {
                return band;
            }
        }

        return Easy;
    }
}
