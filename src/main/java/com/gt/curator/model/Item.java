package com.gt.curator.model;

import java.time.Instant;

public record Item(String id,
                   String learnerId,
                   String itemType,
                   double easeFactor,
                   int intervalDays,
                   int repetitions,
                   Instant lastReviewAt,
                   Instant nextReviewAt,
                   Instant enrolledAt) {

    public static final double DEFAULT_EASE_FACTOR = 2.5;

    public static Item enroll(String id, String learnerId, String itemType, Instant now) {
        return new Item(id, learnerId, itemType, DEFAULT_EASE_FACTOR, 0, 0, null, now, now);
    }

    public MasteryLevel masteryLevel() {
        return MasteryLevel.fromIntervalDays(intervalDays);
    }

    public ItemVersion version() {
        return new ItemVersion(repetitions, nextReviewAt);
    }

    public boolean isNew() {
        return lastReviewAt == null;
    }

    public Item withSchedule(double newEaseFactor, int newIntervalDays, int newRepetitions, Instant reviewedAt, Instant newNextReviewAt) {
        return new Item(id, learnerId, itemType, newEaseFactor, newIntervalDays, newRepetitions, reviewedAt, newNextReviewAt, enrolledAt);
    }
}
