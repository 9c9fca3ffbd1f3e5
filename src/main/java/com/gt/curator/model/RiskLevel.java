package com.gt.curator.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.curator.serialization.RiskLevelSerializer;

@JsonSerialize(using = RiskLevelSerializer.class)
public enum RiskLevel {
    Low("low", 0.8),
    Medium("medium", 0.5),
    High("high", 0.2),
    Critical("critical", 0);

    private final String label;
    private final double minRetention;

    RiskLevel(String label, double minRetention) {
        this.label = label;
        this.minRetention = minRetention;
    }

    public String getLabel() {
        return label;
    }

    public static RiskLevel fromRetention(double retention) {
        for (RiskLevel riskLevel : values()) {
            if (retention >= riskLevel.minRetention) {
                return riskLevel;
            }
        }

        return Critical;
    }
}
