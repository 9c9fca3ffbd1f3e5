package com.gt.curator.scheduling.model;

import com.gt.curator.model.RiskLevel;

public record RetentionAlert(String itemId, String itemType, double retention, long daysOverdue, RiskLevel riskLevel) { }
