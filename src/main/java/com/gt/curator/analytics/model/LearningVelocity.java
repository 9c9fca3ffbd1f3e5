package com.gt.curator.analytics.model;

/**
 * How quickly a learner works through material over a window.
 *
 * @param itemsPerWeek          distinct items reviewed per week of the window's active span
 * @param masteryRate           percentage of reviewed items whose latest interval reached mature
 * @param averageIntervalGrowth mean ratio of latest to first interval, over items reviewed at least twice
 */
public record LearningVelocity(double itemsPerWeek, double masteryRate, double averageIntervalGrowth) {

    public static LearningVelocity empty() {
        return new LearningVelocity(0, 0, 0);
    }
}
