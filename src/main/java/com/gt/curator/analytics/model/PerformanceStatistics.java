package com.gt.curator.analytics.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Review performance over a window of days. Rates and averages are null when the window holds no reviews.
 */
public record PerformanceStatistics(int windowDays,
                                    int totalReviews,
                                    int successfulReviews,
                                    int failedReviews,
                                    Double successRate,
                                    Double averageQuality,
                                    Double averageTimeSpentSeconds,
                                    long totalTimeSeconds,
                                    Map<Integer, Double> qualityDistribution,
                                    int currentStreak,
                                    int longestStreak,
                                    List<DailyStats> dailyStats,
                                    int matureItemsCount,
                                    int itemsInSystemCount) {

    public PerformanceStatistics {
        qualityDistribution = Collections.unmodifiableMap(qualityDistribution);
        dailyStats = Collections.unmodifiableList(dailyStats);
    }
}
