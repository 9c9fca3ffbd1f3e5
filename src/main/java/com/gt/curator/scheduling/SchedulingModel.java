package com.gt.curator.scheduling;

import com.gt.curator.exception.ValidationException;
import com.gt.curator.model.Item;
import com.gt.curator.model.ReviewEvent;
import com.gt.curator.model.ScheduleConfig;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * SM-2 interval and ease factor updates. Stateless; safe to call from any thread.
 */
@Component
public class SchedulingModel {

    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 5;
    // One hundred years
    public static final int MAX_INTERVAL_DAYS = 36_500;

    /**
     * Computes the scheduling state that results from reviewing {@code item} with the given quality.
     *
     * @param item    the item's state before the review
     * @param quality recall quality, 0 (blackout) through 5 (perfect)
     * @param now     the review time; the next review falls {@code intervalDays} after it
     * @param config  the learner's schedule configuration
     * @return the new ease factor, interval, repetition count and next review time
     * @throws ValidationException if quality is outside 0-5
     */
    public SchedulingResult applyReview(Item item, int quality, Instant now, ScheduleConfig config) {
        validateQuality(quality);

        double newEaseFactor = calculateEaseFactor(item.easeFactor(), quality, config.minimumEaseFactor());

        int newRepetitions;
        int newIntervalDays;
        if (quality < ReviewEvent.SUCCESS_QUALITY) {
            newRepetitions = 0;
            newIntervalDays = config.firstInterval();
        } else {
            newRepetitions = item.repetitions() + 1;
            newIntervalDays = calculateInterval(newRepetitions, item.intervalDays(), item.easeFactor(), config);
        }

        return new SchedulingResult(newEaseFactor, newIntervalDays, newRepetitions, now.plus(Duration.ofDays(newIntervalDays)));
    }

    public static void validateQuality(int quality) {
        if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
            throw new ValidationException("Quality must be between " + MIN_QUALITY + " and " + MAX_QUALITY + ", got " + quality);
        }
    }

    // EF' = EF + (0.1 - (5 - q) * (0.08 + (5 - q) * 0.02)), floored at the minimum. No upper bound.
    static double calculateEaseFactor(double currentEaseFactor, int quality, double minimumEaseFactor) {
        int qualityGap = MAX_QUALITY - quality;
        double newEaseFactor = currentEaseFactor + (0.1 - qualityGap * (0.08 + qualityGap * 0.02));

        return Math.max(newEaseFactor, minimumEaseFactor);
    }

    private static int calculateInterval(int newRepetitions, int currentIntervalDays, double currentEaseFactor, ScheduleConfig config) {
        if (newRepetitions == 1) {
            return config.firstInterval();
        } else if (newRepetitions == 2) {
            return config.secondInterval();
        }

        long intervalDays = Math.round(currentIntervalDays * currentEaseFactor);

        return (int) Math.min(MAX_INTERVAL_DAYS, Math.max(1, intervalDays));
    }
}
