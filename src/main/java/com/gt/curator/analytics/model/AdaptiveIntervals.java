package com.gt.curator.analytics.model;

/**
 * Interval range for an item, scaled from its current interval by the learner's recent success.
 *
 * @param learnerSuccessRate success rate the adjustment was based on, 0-1
 */
public record AdaptiveIntervals(String itemId,
                                int currentIntervalDays,
                                int minimumDays,
                                int recommendedDays,
                                int maximumDays,
                                double adjustmentFactor,
                                IntervalAdjustment adjustment,
                                double learnerSuccessRate) { }
