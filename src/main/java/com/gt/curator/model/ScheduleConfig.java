package com.gt.curator.model;

import com.gt.curator.exception.ValidationException;

import java.util.List;

public record ScheduleConfig(int dailyReviewLimit,
                             int newItemsPerDay,
                             ReviewOrder reviewOrder,
                             double minimumEaseFactor,
                             List<Integer> initialIntervals,
                             int breakInterval) {

    public static final int DEFAULT_DAILY_REVIEW_LIMIT = 25;
    public static final int DEFAULT_NEW_ITEMS_PER_DAY = 5;
    public static final double DEFAULT_MINIMUM_EASE_FACTOR = 1.3;
    public static final List<Integer> DEFAULT_INITIAL_INTERVALS = List.of(1, 6);
    public static final int DEFAULT_BREAK_INTERVAL = 10;

    public ScheduleConfig {
        if (initialIntervals == null || initialIntervals.size() != 2) {
            throw new ValidationException("Exactly two initial intervals are required, got " + initialIntervals);
        }
        initialIntervals = List.copyOf(initialIntervals);
        if (reviewOrder == null) {
            reviewOrder = ReviewOrder.Urgency;
        }
    }

    public static ScheduleConfig defaults() {
        return new ScheduleConfig(DEFAULT_DAILY_REVIEW_LIMIT, DEFAULT_NEW_ITEMS_PER_DAY, ReviewOrder.Urgency,
                DEFAULT_MINIMUM_EASE_FACTOR, DEFAULT_INITIAL_INTERVALS, DEFAULT_BREAK_INTERVAL);
    }

    public int firstInterval() {
        return initialIntervals.get(0);
    }

    public int secondInterval() {
        return initialIntervals.get(1);
    }
}
