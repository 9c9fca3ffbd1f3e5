package com.gt.curator.analytics;

import com.gt.curator.analytics.model.*;
import com.gt.curator.model.Item;
import com.gt.curator.model.MasteryLevel;
import com.gt.curator.model.ReviewEvent;
import com.gt.curator.scheduling.SchedulingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;

/**
 * Read-only statistics over a learner's review events and items: window totals and streaks, learning velocity,
 * difficulty bands, quality trend and milestones, and adaptive interval ranges.
 */
@Component
public class PerformanceAnalytics {

    private static final Logger log = LoggerFactory.getLogger(PerformanceAnalytics.class);

    static final int TREND_WINDOW = 10;
    static final int TREND_SAMPLE = 5;
    static final int STRUGGLING_LOOKBACK = 3;
    static final int STRUGGLING_FAILURES = 2;
    static final List<Integer> REVIEW_COUNT_MILESTONES = List.of(10, 50, 100, 500, 1000);

    static final double DEFAULT_SUCCESS_RATE = 0.8;
    static final double LOW_SUCCESS_RATE = 0.7;
    static final double HIGH_SUCCESS_RATE = 0.9;
    static final int ITEM_HISTORY_LOOKBACK = 3;
    static final double LOW_RECENT_QUALITY = 3.5;
    static final double HIGH_RECENT_QUALITY = 4.5;

    private final ZoneId zoneId;

    @Autowired
    public PerformanceAnalytics(ZoneId curatorZoneId) {
        this.zoneId = curatorZoneId;
    }

    // Events in (now - windowDays, now], oldest first
    static List<ReviewEvent> eventsInWindow(Collection<ReviewEvent> events, int windowDays, Instant now) {
        Instant windowStart = now.minus(Duration.ofDays(Math.max(windowDays, 0)));

        return events.stream()
                .filter(event -> event.submittedAt().isAfter(windowStart) && !event.submittedAt().isAfter(now))
                .sorted(Comparator.comparing(ReviewEvent::submittedAt))
                .toList();
    }

    public PerformanceStatistics computeStatistics(Collection<ReviewEvent> events, Collection<Item> items, int windowDays, Instant now) {
        List<ReviewEvent> windowEvents = eventsInWindow(events, windowDays, now);

        int totalReviews = windowEvents.size();
        int successfulReviews = 0;
        long totalQuality = 0;
        long totalTimeSeconds = 0;
        int[] qualityCounts = new int[SchedulingModel.MAX_QUALITY + 1];
        for (ReviewEvent event : windowEvents) {
            if (event.isSuccessful()) {
                successfulReviews++;
            }
            totalQuality += event.quality();
            totalTimeSeconds += event.timeSpentSeconds();
            qualityCounts[event.quality()]++;
        }

        List<DailyStats> dailyStats = buildDailyStats(windowEvents);
        Set<LocalDate> successfulDays = new HashSet<>();
        for (DailyStats day : dailyStats) {
            if (day.successfulCount() > 0) {
                successfulDays.add(day.date());
            }
        }

        int matureItemsCount = (int) items.stream().filter(item -> item.masteryLevel() == MasteryLevel.Mature).count();
        log.debug("{} reviews over {} days, {} of {} items mature", totalReviews, windowDays, matureItemsCount, items.size());

        return new PerformanceStatistics(
                windowDays,
                totalReviews,
                successfulReviews,
                totalReviews - successfulReviews,
                totalReviews == 0 ? null : (double) successfulReviews / totalReviews,
                totalReviews == 0 ? null : (double) totalQuality / totalReviews,
                totalReviews == 0 ? null : (double) totalTimeSeconds / totalReviews,
                totalTimeSeconds,
                buildQualityDistribution(qualityCounts, totalReviews),
                calculateCurrentStreak(successfulDays, LocalDate.ofInstant(now, zoneId)),
                calculateLongestStreak(successfulDays),
                dailyStats,
                matureItemsCount,
                items.size());
    }

    private List<DailyStats> buildDailyStats(List<ReviewEvent> windowEvents) {
        Map<LocalDate, List<ReviewEvent>> eventsByDate = new TreeMap<>();
        for (ReviewEvent event : windowEvents) {
            eventsByDate.computeIfAbsent(LocalDate.ofInstant(event.submittedAt(), zoneId), date -> new ArrayList<>()).add(event);
        }

        List<DailyStats> dailyStats = new ArrayList<>();
        for (Map.Entry<LocalDate, List<ReviewEvent>> dateEvents : eventsByDate.entrySet()) {
            int reviewsCount = dateEvents.getValue().size();
            int successfulCount = (int) dateEvents.getValue().stream().filter(ReviewEvent::isSuccessful).count();

            dailyStats.add(new DailyStats(dateEvents.getKey(), reviewsCount, successfulCount, (double) successfulCount / reviewsCount));
        }

        return dailyStats;
    }

    // Percentages per quality 0-5. All zero when there are no reviews.
    private static Map<Integer, Double> buildQualityDistribution(int[] qualityCounts, int totalReviews) {
        Map<Integer, Double> distribution = new LinkedHashMap<>();
        for (int quality = SchedulingModel.MIN_QUALITY; quality <= SchedulingModel.MAX_QUALITY; quality++) {
            distribution.put(quality, totalReviews == 0 ? 0.0 : qualityCounts[quality] * 100.0 / totalReviews);
        }

        return distribution;
    }

    // Walks back from today. A day without a successful review, including a day without any review, ends the streak.
    static int calculateCurrentStreak(Set<LocalDate> successfulDays, LocalDate today) {
        int streak = 0;

        LocalDate day = today;
        while (successfulDays.contains(day)) {
            streak++;
            day = day.minusDays(1);
        }

        return streak;
    }

    static int calculateLongestStreak(Set<LocalDate> successfulDays) {
        int longestStreak = 0;

        for (LocalDate day : successfulDays) {
            if (successfulDays.contains(day.minusDays(1))) {
                continue;
            }

            int streak = 1;
            while (successfulDays.contains(day.plusDays(streak))) {
                streak++;
            }
            longestStreak = Math.max(longestStreak, streak);
        }

        return longestStreak;
    }

    /**
     * Distinct items reviewed per week of the span between the first and last event (at least one day), the share of
     * those items whose latest interval is mature, and the mean growth from first to latest interval.
     *
     * @param sortedEvents events oldest first
     */
    public LearningVelocity calculateLearningVelocity(List<ReviewEvent> sortedEvents) {
        if (sortedEvents.isEmpty()) {
            return LearningVelocity.empty();
        }

        Map<String, List<ReviewEvent>> eventsByItem = groupByItem(sortedEvents);

        int masteredItems = 0;
        List<Double> intervalGrowths = new ArrayList<>();
        for (List<ReviewEvent> itemEvents : eventsByItem.values()) {
            ReviewEvent latest = itemEvents.get(itemEvents.size() - 1);
            if (MasteryLevel.fromIntervalDays(latest.resultingIntervalDays()) == MasteryLevel.Mature) {
                masteredItems++;
            }

            if (itemEvents.size() >= 2) {
                int firstInterval = itemEvents.get(0).resultingIntervalDays();
                intervalGrowths.add(firstInterval > 0 ? (double) latest.resultingIntervalDays() / firstInterval : 0);
            }
        }

        long spanDays = Duration.between(sortedEvents.get(0).submittedAt(), sortedEvents.get(sortedEvents.size() - 1).submittedAt()).toDays();
        double weeks = Math.max(spanDays, 1) / 7.0;

        return new LearningVelocity(
                eventsByItem.size() / weeks,
                masteredItems * 100.0 / eventsByItem.size(),
                intervalGrowths.stream().mapToDouble(Double::doubleValue).average().orElse(0));
    }

    /**
     * @param sortedEvents events oldest first
     */
    public DifficultyAnalysis analyzeDifficulty(List<ReviewEvent> sortedEvents) {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (DifficultyBand band : DifficultyBand.values()) {
            distribution.put(band.getLabel(), 0);
        }

        List<StrugglingItem> strugglingItems = new ArrayList<>();
        for (Map.Entry<String, List<ReviewEvent>> itemEvents : groupByItem(sortedEvents).entrySet()) {
            List<ReviewEvent> reviews = itemEvents.getValue();
            double latestEaseFactor = reviews.get(reviews.size() - 1).resultingEaseFactor();

            distribution.merge(DifficultyBand.fromEaseFactor(latestEaseFactor).getLabel(), 1, Integer::sum);

            if (reviews.size() >= STRUGGLING_LOOKBACK) {
                List<Integer> recentQualities = reviews.subList(reviews.size() - STRUGGLING_LOOKBACK, reviews.size()).stream()
                        .map(ReviewEvent::quality)
                        .toList();
                long recentFailures = recentQualities.stream().filter(quality -> quality < ReviewEvent.SUCCESS_QUALITY).count();

                if (recentFailures >= STRUGGLING_FAILURES) {
                    strugglingItems.add(new StrugglingItem(itemEvents.getKey(), recentQualities, latestEaseFactor));
                }
            }
        }

        Double averageEaseFactor = sortedEvents.isEmpty()
                ? null
                : sortedEvents.stream().mapToDouble(ReviewEvent::resultingEaseFactor).average().orElse(0);

        return new DifficultyAnalysis(distribution, strugglingItems, averageEaseFactor);
    }

    /**
     * Compares the mean of the last five against the first five points of a ten review moving average of quality.
     *
     * @param sortedEvents events oldest first
     */
    public ProgressIndicators calculateProgress(List<ReviewEvent> sortedEvents) {
        List<Double> qualityTrend = new ArrayList<>();
        for (int i = 0; i < sortedEvents.size(); i++) {
            List<ReviewEvent> window = sortedEvents.subList(Math.max(0, i - TREND_WINDOW + 1), i + 1);
            qualityTrend.add(window.stream().mapToInt(ReviewEvent::quality).average().orElse(0));
        }

        ProgressTrend trend = ProgressTrend.Stable;
        double trendStrength = 0;
        if (qualityTrend.size() >= 2) {
            double olderAverage = average(qualityTrend.subList(0, Math.min(TREND_SAMPLE, qualityTrend.size())));
            double recentAverage = average(qualityTrend.subList(Math.max(0, qualityTrend.size() - TREND_SAMPLE), qualityTrend.size()));

            if (recentAverage > olderAverage) {
                trend = ProgressTrend.Improving;
            } else if (recentAverage < olderAverage) {
                trend = ProgressTrend.Declining;
            }
            trendStrength = Math.abs(recentAverage - olderAverage);
        }

        return new ProgressIndicators(
                trend,
                trendStrength,
                qualityTrend.isEmpty() ? null : qualityTrend.get(qualityTrend.size() - 1),
                calculateMilestones(sortedEvents));
    }

    static List<Milestone> calculateMilestones(List<ReviewEvent> sortedEvents) {
        List<Milestone> milestones = new ArrayList<>();

        sortedEvents.stream()
                .filter(ReviewEvent::isSuccessful)
                .findFirst()
                .ifPresent(event -> milestones.add(new Milestone(Milestone.FIRST_SUCCESS, event.submittedAt(), "First successful review")));
        sortedEvents.stream()
                .filter(event -> event.quality() == SchedulingModel.MAX_QUALITY)
                .findFirst()
                .ifPresent(event -> milestones.add(new Milestone(Milestone.FIRST_PERFECT, event.submittedAt(), "First perfect recall")));

        for (int reviewCount : REVIEW_COUNT_MILESTONES) {
            if (sortedEvents.size() >= reviewCount) {
                milestones.add(Milestone.reviewCount(reviewCount, sortedEvents.get(reviewCount - 1).submittedAt()));
            }
        }

        milestones.sort(Comparator.comparing(Milestone::achievedAt));

        return milestones;
    }

    /**
     * Scales the item's current interval by the learner's success rate (0.8 below 70%, 1.2 above 90%) and by the
     * item's last three qualities (0.9 when they average below 3.5, 1.1 above 4.5). The minimum and maximum are 80%
     * and 120% of the recommendation. All three are at least one day.
     *
     * @param itemEvents         the item's review events, oldest first
     * @param learnerSuccessRate the learner's success rate, or null without reviews
     */
    public AdaptiveIntervals recommendIntervals(Item item, List<ReviewEvent> itemEvents, Double learnerSuccessRate) {
        double successRate = learnerSuccessRate == null ? DEFAULT_SUCCESS_RATE : learnerSuccessRate;

        double adjustmentFactor = 1.0;
        if (successRate < LOW_SUCCESS_RATE) {
            adjustmentFactor = 0.8;
        } else if (successRate > HIGH_SUCCESS_RATE) {
            adjustmentFactor = 1.2;
        }

        if (itemEvents.size() >= ITEM_HISTORY_LOOKBACK) {
            double recentQuality = itemEvents.subList(itemEvents.size() - ITEM_HISTORY_LOOKBACK, itemEvents.size()).stream()
                    .mapToInt(ReviewEvent::quality)
                    .average()
                    .orElse(0);

            if (recentQuality < LOW_RECENT_QUALITY) {
                adjustmentFactor *= 0.9;
            } else if (recentQuality > HIGH_RECENT_QUALITY) {
                adjustmentFactor *= 1.1;
            }
        }

        IntervalAdjustment adjustment = IntervalAdjustment.Standard;
        if (adjustmentFactor < 0.9) {
            adjustment = IntervalAdjustment.Shortened;
        } else if (adjustmentFactor > 1.1) {
            adjustment = IntervalAdjustment.Extended;
        }

        double recommended = item.intervalDays() * adjustmentFactor;

        return new AdaptiveIntervals(
                item.id(),
                item.intervalDays(),
                toIntervalDays(recommended * 0.8),
                toIntervalDays(recommended),
                toIntervalDays(recommended * 1.2),
                adjustmentFactor,
                adjustment,
                successRate);
    }

    private static int toIntervalDays(double days) {
        return (int) Math.min(SchedulingModel.MAX_INTERVAL_DAYS, Math.max(1, Math.floor(days)));
    }

    // Keeps each item's events in the order given
    private static Map<String, List<ReviewEvent>> groupByItem(List<ReviewEvent> events) {
        Map<String, List<ReviewEvent>> eventsByItem = new LinkedHashMap<>();
        for (ReviewEvent event : events) {
            eventsByItem.computeIfAbsent(event.itemId(), itemId -> new ArrayList<>()).add(event);
        }

        return eventsByItem;
    }

    private static double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }
}
