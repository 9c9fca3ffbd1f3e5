package com.gt.curator.scheduling;

import com.gt.curator.exception.ValidationException;
import com.gt.curator.model.Item;
import com.gt.curator.model.RiskLevel;
import com.gt.curator.scheduling.model.RetentionAlert;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Forgetting curve estimate: {@code R = exp(-t / S)} with {@code S = max(interval, 1) * (EF / 2.5) * stabilityScale}.
 * R is 1 right after a review, falls as days pass, and falls more slowly for items with a higher ease factor.
 */
@Component
public class RetentionEstimator {

    public static final double DEFAULT_ALERT_THRESHOLD = 0.9;

    private static final double SECONDS_PER_DAY = 86400d;

    private final double stabilityScale;

    @Autowired
    public RetentionEstimator(@Value("${curator.retention.stabilityScale:1.0}") double stabilityScale) {
        if (stabilityScale <= 0) {
            throw new IllegalArgumentException("Stability scale must be positive, got " + stabilityScale);
        }

        this.stabilityScale = stabilityScale;
    }

    public double estimateRetention(Item item, Instant now) {
        if (item.lastReviewAt() == null) {
            return 1.0;
        }

        double daysElapsed = Duration.between(item.lastReviewAt(), now).getSeconds() / SECONDS_PER_DAY;
        if (daysElapsed <= 0) {
            return 1.0;
        }

        double retention = Math.exp(-daysElapsed / calculateStability(item));

        return Math.max(0.0, Math.min(1.0, retention));
    }

    public RiskLevel getRiskLevel(Item item, Instant now) {
        return RiskLevel.fromRetention(estimateRetention(item, now));
    }

    // Solves exp(-t / S) = target for t
    public int calculateOptimalReviewDays(Item item, double targetRetention) {
        if (targetRetention <= 0 || targetRetention >= 1) {
            throw new ValidationException("Target retention must be between 0 and 1 exclusive, got " + targetRetention);
        }

        return (int) Math.max(1, Math.round(-calculateStability(item) * Math.log(targetRetention)));
    }

    public List<RetentionAlert> getRetentionAlerts(Collection<Item> items, double threshold, Instant now) {
        List<RetentionAlert> alerts = new ArrayList<>();

        for (Item item : items) {
            if (item.isNew()) {
                continue;
            }

            double retention = estimateRetention(item, now);
            if (retention < threshold) {
                long daysOverdue = item.nextReviewAt() == null ? 0 : Duration.between(item.nextReviewAt(), now).toDays();
                alerts.add(new RetentionAlert(item.id(), item.itemType(), retention, daysOverdue, RiskLevel.fromRetention(retention)));
            }
        }

        alerts.sort(Comparator.comparingDouble(RetentionAlert::retention));

        return alerts;
    }

    double calculateStability(Item item) {
        return Math.max(item.intervalDays(), 1) * (item.easeFactor() / Item.DEFAULT_EASE_FACTOR) * stabilityScale;
    }
}
