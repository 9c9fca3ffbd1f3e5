package com.gt.curator.analytics;

import com.gt.curator.analytics.model.*;
import com.gt.curator.model.Item;
import com.gt.curator.model.ReviewEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.gt.curator.util.TestItems.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class PerformanceAnalyticsTests {

    private static final Instant NOW = Instant.parse("2024-03-10T18:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 10);

    private PerformanceAnalytics performanceAnalytics;

    @BeforeEach
    public void setup() {
        performanceAnalytics = new PerformanceAnalytics(ZoneOffset.UTC);
    }

    @Test
    public void testNoEvents() {
        PerformanceStatistics statistics = performanceAnalytics.computeStatistics(List.of(), List.of(), 30, NOW);

        assertEquals(0, statistics.totalReviews());
        assertNull(statistics.successRate());
        assertNull(statistics.averageQuality());
        assertNull(statistics.averageTimeSpentSeconds());
        assertEquals(6, statistics.qualityDistribution().size());
        assertTrue(statistics.qualityDistribution().values().stream().allMatch(percentage -> percentage == 0.0));
        assertTrue(statistics.dailyStats().isEmpty());
        assertEquals(0, statistics.currentStreak());
        assertEquals(0, statistics.longestStreak());
        assertEquals(0, statistics.itemsInSystemCount());
    }

    @Test
    public void testStatisticsOverWindow() {
        List<ReviewEvent> events = List.of(
                event("a", NOW.minus(Duration.ofDays(40)), 5, 10),
                event("a", NOW.minus(Duration.ofDays(2)), 4, 20),
                event("b", NOW.minus(Duration.ofDays(2)).plus(Duration.ofMinutes(5)), 1, 40),
                event("a", NOW.minus(Duration.ofDays(1)), 5, 30),
                event("b", NOW.minus(Duration.ofHours(1)), 3, 10));
        List<Item> items = List.of(
                reviewedItem("a", 2.6, 21, 5, NOW.minus(Duration.ofDays(1))),
                reviewedItem("b", 2.2, 1, 1, NOW.minus(Duration.ofHours(1))),
                newItem("c", NOW));

        PerformanceStatistics statistics = performanceAnalytics.computeStatistics(events, items, 30, NOW);

        assertEquals(4, statistics.totalReviews());
        assertEquals(3, statistics.successfulReviews());
        assertEquals(1, statistics.failedReviews());
        assertEquals(0.75, statistics.successRate());
        assertEquals(3.25, statistics.averageQuality());
        assertEquals(25.0, statistics.averageTimeSpentSeconds());
        assertEquals(100, statistics.totalTimeSeconds());

        assertEquals(0.0, statistics.qualityDistribution().get(0));
        assertEquals(25.0, statistics.qualityDistribution().get(1));
        assertEquals(25.0, statistics.qualityDistribution().get(3));
        assertEquals(25.0, statistics.qualityDistribution().get(4));
        assertEquals(25.0, statistics.qualityDistribution().get(5));
        assertEquals(100.0, statistics.qualityDistribution().values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);

        assertEquals(List.of(
                new DailyStats(TODAY.minusDays(2), 2, 1, 0.5),
                new DailyStats(TODAY.minusDays(1), 1, 1, 1.0),
                new DailyStats(TODAY, 1, 1, 1.0)), statistics.dailyStats());

        assertEquals(3, statistics.currentStreak());
        assertEquals(3, statistics.longestStreak());
        assertEquals(1, statistics.matureItemsCount());
        assertEquals(3, statistics.itemsInSystemCount());
    }

    @Test
    public void testQualityDistributionNotRounded() {
        List<ReviewEvent> events = List.of(
                event("a", NOW.minus(Duration.ofHours(3)), 2, 10),
                event("b", NOW.minus(Duration.ofHours(2)), 4, 10),
                event("c", NOW.minus(Duration.ofHours(1)), 5, 10));

        PerformanceStatistics statistics = performanceAnalytics.computeStatistics(events, List.of(), 7, NOW);

        assertEquals(100.0 / 3, statistics.qualityDistribution().get(2), 1e-9);
        assertEquals(100.0, statistics.qualityDistribution().values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
    }

    @Test
    public void testCurrentStreak() {
        assertEquals(0, PerformanceAnalytics.calculateCurrentStreak(Set.of(), TODAY));
        assertEquals(0, PerformanceAnalytics.calculateCurrentStreak(Set.of(TODAY.minusDays(1), TODAY.minusDays(2)), TODAY));
        assertEquals(2, PerformanceAnalytics.calculateCurrentStreak(Set.of(TODAY, TODAY.minusDays(1), TODAY.minusDays(3)), TODAY));
    }

    @Test
    public void testLongestStreak() {
        assertEquals(0, PerformanceAnalytics.calculateLongestStreak(Set.of()));
        assertEquals(1, PerformanceAnalytics.calculateLongestStreak(Set.of(TODAY)));
        assertEquals(3, PerformanceAnalytics.calculateLongestStreak(Set.of(
                TODAY, TODAY.minusDays(2), TODAY.minusDays(3), TODAY.minusDays(4), TODAY.minusDays(10), TODAY.minusDays(11))));
    }

    @Test
    public void testFailedDayBreaksStreak() {
        List<ReviewEvent> events = List.of(
                event("a", NOW.minus(Duration.ofDays(2)), 4, 10),
                event("a", NOW.minus(Duration.ofDays(1)), 1, 10),
                event("a", NOW.minus(Duration.ofHours(1)), 4, 10));

        PerformanceStatistics statistics = performanceAnalytics.computeStatistics(events, List.of(), 30, NOW);

        assertEquals(1, statistics.currentStreak());
        assertEquals(1, statistics.longestStreak());
    }

    @Test
    public void testLearningVelocity() {
        Instant start = NOW.minus(Duration.ofDays(14));
        List<ReviewEvent> events = List.of(
                scheduledEvent("a", start, 4, 1, 2.5),
                scheduledEvent("b", start.plus(Duration.ofHours(1)), 4, 1, 2.5),
                scheduledEvent("a", start.plus(Duration.ofDays(7)), 4, 6, 2.5),
                scheduledEvent("a", start.plus(Duration.ofDays(14)), 5, 25, 2.6),
                scheduledEvent("b", start.plus(Duration.ofDays(14)), 3, 3, 2.36),
                scheduledEvent("c", start.plus(Duration.ofDays(14)), 4, 1, 2.5));

        LearningVelocity velocity = performanceAnalytics.calculateLearningVelocity(events);

        assertEquals(1.5, velocity.itemsPerWeek(), 1e-9);
        assertEquals(100.0 / 3, velocity.masteryRate(), 1e-9);
        assertEquals(14.0, velocity.averageIntervalGrowth(), 1e-9);

        assertEquals(LearningVelocity.empty(), performanceAnalytics.calculateLearningVelocity(List.of()));
    }

    @Test
    public void testLearningVelocityWithinOneDay() {
        List<ReviewEvent> events = List.of(
                scheduledEvent("a", NOW.minus(Duration.ofHours(2)), 4, 1, 2.5),
                scheduledEvent("b", NOW.minus(Duration.ofHours(1)), 4, 1, 2.5));

        LearningVelocity velocity = performanceAnalytics.calculateLearningVelocity(events);

        assertEquals(14.0, velocity.itemsPerWeek(), 1e-9);
        assertEquals(0.0, velocity.masteryRate());
        assertEquals(0.0, velocity.averageIntervalGrowth());
    }

    @Test
    public void testDifficultyAnalysis() {
        Instant start = NOW.minus(Duration.ofDays(10));
        List<ReviewEvent> events = List.of(
                scheduledEvent("x", start, 4, 1, 2.0),
                scheduledEvent("x", start.plus(Duration.ofDays(1)), 1, 1, 1.6),
                scheduledEvent("x", start.plus(Duration.ofDays(2)), 2, 1, 1.3),
                scheduledEvent("y", start, 1, 1, 2.0),
                scheduledEvent("y", start.plus(Duration.ofDays(1)), 4, 1, 1.9),
                scheduledEvent("y", start.plus(Duration.ofDays(2)), 4, 6, 1.8),
                scheduledEvent("y", start.plus(Duration.ofDays(8)), 2, 1, 1.7),
                scheduledEvent("z", start, 4, 1, 2.2),
                scheduledEvent("w", start, 5, 1, 2.6),
                scheduledEvent("v", start, 4, 1, 2.3));

        DifficultyAnalysis analysis = performanceAnalytics.analyzeDifficulty(events);

        assertThat(analysis.distribution())
                .containsEntry("very_hard", 1)
                .containsEntry("hard", 1)
                .containsEntry("medium", 1)
                .containsEntry("easy", 2);

        assertEquals(1, analysis.strugglingItems().size());
        StrugglingItem struggling = analysis.strugglingItems().get(0);
        assertEquals("x", struggling.itemId());
        assertEquals(List.of(4, 1, 2), struggling.recentQualities());
        assertEquals(1.3, struggling.easeFactor());

        assertEquals(1.94, analysis.averageEaseFactor().doubleValue(), 1e-9);
    }

    @Test
    public void testDifficultyAnalysisWithoutEvents() {
        DifficultyAnalysis analysis = performanceAnalytics.analyzeDifficulty(List.of());

        assertEquals(4, analysis.distribution().size());
        assertTrue(analysis.distribution().values().stream().allMatch(count -> count == 0));
        assertTrue(analysis.strugglingItems().isEmpty());
        assertNull(analysis.averageEaseFactor());
    }

    @Test
    public void testImprovingProgressAndMilestones() {
        List<ReviewEvent> events = eventsWithQualities(1, 1, 1, 1, 1, 5, 5, 5, 5, 5);

        ProgressIndicators progress = performanceAnalytics.calculateProgress(events);

        assertEquals(ProgressTrend.Improving, progress.trend());
        assertThat(progress.trendStrength()).isGreaterThan(1.0);
        assertEquals(3.0, progress.currentPerformance().doubleValue(), 1e-9);

        assertThat(progress.milestones()).extracting(Milestone::type)
                .containsExactly(Milestone.FIRST_SUCCESS, Milestone.FIRST_PERFECT, "reviews_10");
        assertEquals(events.get(5).submittedAt(), progress.milestones().get(0).achievedAt());
        assertEquals(events.get(9).submittedAt(), progress.milestones().get(2).achievedAt());
    }

    @Test
    public void testDecliningAndStableProgress() {
        ProgressIndicators declining = performanceAnalytics.calculateProgress(eventsWithQualities(5, 5, 4, 2, 1, 1, 0));
        assertEquals(ProgressTrend.Declining, declining.trend());

        ProgressIndicators single = performanceAnalytics.calculateProgress(eventsWithQualities(4));
        assertEquals(ProgressTrend.Stable, single.trend());
        assertEquals(0.0, single.trendStrength());
        assertEquals(4.0, single.currentPerformance().doubleValue());

        ProgressIndicators empty = performanceAnalytics.calculateProgress(List.of());
        assertEquals(ProgressTrend.Stable, empty.trend());
        assertNull(empty.currentPerformance());
        assertTrue(empty.milestones().isEmpty());
    }

    @Test
    public void testAdaptiveIntervalsForStrongLearner() {
        Item item = reviewedItem("a", 2.5, 10, 3, NOW.minus(Duration.ofDays(10)));

        AdaptiveIntervals intervals = performanceAnalytics.recommendIntervals(item, List.of(), 0.95);

        assertEquals(10, intervals.currentIntervalDays());
        assertEquals(9, intervals.minimumDays());
        assertEquals(12, intervals.recommendedDays());
        assertEquals(14, intervals.maximumDays());
        assertEquals(IntervalAdjustment.Extended, intervals.adjustment());
    }

    @Test
    public void testAdaptiveIntervalsForStrugglingItem() {
        Item item = reviewedItem("a", 1.5, 10, 3, NOW.minus(Duration.ofDays(10)));
        List<ReviewEvent> itemEvents = List.of(
                scheduledEvent("a", NOW.minus(Duration.ofDays(5)), 1, 1, 1.8),
                scheduledEvent("a", NOW.minus(Duration.ofDays(4)), 2, 1, 1.6),
                scheduledEvent("a", NOW.minus(Duration.ofDays(3)), 3, 10, 1.5));

        AdaptiveIntervals intervals = performanceAnalytics.recommendIntervals(item, itemEvents, 0.5);

        assertEquals(0.72, intervals.adjustmentFactor(), 1e-9);
        assertEquals(5, intervals.minimumDays());
        assertEquals(7, intervals.recommendedDays());
        assertEquals(8, intervals.maximumDays());
        assertEquals(IntervalAdjustment.Shortened, intervals.adjustment());
        assertEquals(0.5, intervals.learnerSuccessRate());
    }

    @Test
    public void testAdaptiveIntervalsWithoutLearnerHistory() {
        Item item = reviewedItem("a", 2.7, 10, 5, NOW.minus(Duration.ofDays(10)));
        List<ReviewEvent> itemEvents = eventsWithQualities(5, 5, 5);

        AdaptiveIntervals intervals = performanceAnalytics.recommendIntervals(item, itemEvents, null);

        assertEquals(PerformanceAnalytics.DEFAULT_SUCCESS_RATE, intervals.learnerSuccessRate());
        assertEquals(11, intervals.recommendedDays());
        assertEquals(IntervalAdjustment.Standard, intervals.adjustment());

        AdaptiveIntervals newItemIntervals = performanceAnalytics.recommendIntervals(newItem("b", NOW), List.of(), null);
        assertEquals(1, newItemIntervals.minimumDays());
        assertEquals(1, newItemIntervals.recommendedDays());
        assertEquals(1, newItemIntervals.maximumDays());
    }

    // One review per hour ending an hour before NOW
    private static List<ReviewEvent> eventsWithQualities(int... qualities) {
        List<ReviewEvent> events = new ArrayList<>();
        for (int i = 0; i < qualities.length; i++) {
            events.add(scheduledEvent("a", NOW.minus(Duration.ofHours(qualities.length - i)), qualities[i], 1, 2.5));
        }

        return events;
    }
}
