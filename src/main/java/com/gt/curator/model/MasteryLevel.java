package com.gt.curator.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.curator.serialization.MasteryLevelSerializer;

@JsonSerialize(using = MasteryLevelSerializer.class)
public enum MasteryLevel {
    New("new", 0),
    Learning("learning", 1),
    Young("young", 7),
    Mature("mature", 21);

    private final String label;
    private final int minIntervalDays;

    MasteryLevel(String label, int minIntervalDays) {
        this.label = label;
        this.minIntervalDays = minIntervalDays;
    }

    public String getLabel() {
        return label;
    }

    public int getMinIntervalDays() {
        return minIntervalDays;
    }

    public static MasteryLevel fromIntervalDays(int intervalDays) {
        if (intervalDays >= Mature.minIntervalDays) {
            return Mature;
        } else if (intervalDays >= Young.minIntervalDays) {
            return Young;
        } else if (intervalDays >= Learning.minIntervalDays) {
            return Learning;
        }

        return New;
    }
}
