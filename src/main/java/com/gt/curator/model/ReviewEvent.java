package com.gt.curator.model;

import java.time.Instant;

public record ReviewEvent(long eventId,
                          String learnerId,
                          String itemId,
                          String itemType,
                          Instant submittedAt,
                          int quality,
                          int timeSpentSeconds,
                          int resultingIntervalDays,
                          double resultingEaseFactor,
                          boolean firstReview) {

    public static final int SUCCESS_QUALITY = 3;

    public boolean isSuccessful() {
        return quality >= SUCCESS_QUALITY;
    }
}
