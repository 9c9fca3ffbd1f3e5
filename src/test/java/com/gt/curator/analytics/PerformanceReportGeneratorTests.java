package com.gt.curator.analytics;

import com.gt.curator.analytics.model.PerformanceGrade;
import com.gt.curator.analytics.model.PerformanceReport;
import com.gt.curator.model.ReviewEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.gt.curator.util.TestItems.scheduledEvent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class PerformanceReportGeneratorTests {

    private static final Instant NOW = Instant.parse("2024-03-10T18:00:00Z");
    private static final Instant TODAY_START = Instant.parse("2024-03-10T00:00:00Z");

    private PerformanceAnalytics performanceAnalytics;
    private AdaptiveScheduleAdvisor adaptiveScheduleAdvisor;
    private PerformanceReportGenerator performanceReportGenerator;

    @BeforeEach
    public void setup() {
        performanceAnalytics = new PerformanceAnalytics(ZoneOffset.UTC);
        adaptiveScheduleAdvisor = new AdaptiveScheduleAdvisor(ZoneOffset.UTC);
        performanceReportGenerator = new PerformanceReportGenerator();
    }

    @Test
    public void testReportWithoutReviews() {
        PerformanceReport report = generateReport(List.of());

        assertEquals(30, report.windowDays());
        assertEquals(NOW, report.generatedAt());
        assertEquals(0, report.statistics().totalReviews());
        assertTrue(report.insights().isEmpty());
        assertTrue(report.recommendations().isEmpty());
        assertEquals(PerformanceGrade.D, report.grade());
    }

    @Test
    public void testReportForStrongLearner() {
        List<ReviewEvent> events = new ArrayList<>();
        for (int day = 9; day >= 0; day--) {
            Instant sessionStart = TODAY_START.minus(Duration.ofDays(day)).plus(Duration.ofHours(9));
            events.add(scheduledEvent("a", sessionStart, 5, 30, 2.6));
            events.add(scheduledEvent("b", sessionStart.plus(Duration.ofMinutes(10)), 5, 30, 2.6));
            events.add(scheduledEvent("c", sessionStart.plus(Duration.ofMinutes(20)), 5, 30, 2.6));
        }

        PerformanceReport report = generateReport(events);

        assertThat(report.insights()).containsExactly(
                "Excellent performance, your success rate is above 90%.",
                "You are on a 10-day review streak.",
                "You perform best at 09:00 (average quality 5.00).");
        assertTrue(report.recommendations().isEmpty());
        assertEquals(100.0, report.learningVelocity().masteryRate(), 1e-9);
        assertThat(report.consistencyScore()).isGreaterThan(99.0);
        assertEquals(PerformanceGrade.APlus, report.grade());
    }

    @Test
    public void testReportForStrugglingLearner() {
        // Reviews spread evenly around the clock on consecutive days
        Instant start = Instant.parse("2024-03-04T00:00:00Z");
        int[] qualities = {1, 2, 1, 0, 1, 2};
        List<ReviewEvent> events = new ArrayList<>();
        for (int i = 0; i < qualities.length; i++) {
            ReviewEvent event = scheduledEvent("a", start.plus(Duration.ofDays(i)).plus(Duration.ofHours(4L * i)), qualities[i], 1, 1.3);
            events.add(new ReviewEvent(event.eventId(), event.learnerId(), event.itemId(), event.itemType(), event.submittedAt(),
                    event.quality(), 200, event.resultingIntervalDays(), event.resultingEaseFactor(), event.firstReview()));
        }

        PerformanceReport report = generateReport(events);

        assertThat(report.insights()).contains("Your success rate is below 70%. Consider reviewing items more frequently.");
        assertThat(report.recommendations()).containsExactly(
                "Reviews take over 2 minutes on average. Consider splitting complex items into smaller ones.",
                "You are struggling with 1 items. Consider adding notes or examples for them.",
                "Your review times vary a lot. Try to review at the same time every day.",
                "Less than 20% of your items have reached mastery. Focus on quality over quantity when learning new material.");
        assertEquals(PerformanceGrade.D, report.grade());
    }

    @Test
    public void testGradeWeights() {
        assertEquals(PerformanceGrade.APlus, PerformanceReportGenerator.calculateGrade(1.0, 100, 70));
        assertEquals(PerformanceGrade.A, PerformanceReportGenerator.calculateGrade(1.0, 100, 40));
        assertEquals(PerformanceGrade.B, PerformanceReportGenerator.calculateGrade(1.0, 50, 50));
        assertEquals(PerformanceGrade.C, PerformanceReportGenerator.calculateGrade(0.75, 50, 50));
        assertEquals(PerformanceGrade.D, PerformanceReportGenerator.calculateGrade(null, 0, 0));
    }

    private PerformanceReport generateReport(List<ReviewEvent> events) {
        List<ReviewEvent> windowEvents = PerformanceAnalytics.eventsInWindow(events, 30, NOW);

        return performanceReportGenerator.generateReport(
                performanceAnalytics.computeStatistics(windowEvents, List.of(), 30, NOW),
                performanceAnalytics.calculateLearningVelocity(windowEvents),
                performanceAnalytics.analyzeDifficulty(windowEvents),
                performanceAnalytics.calculateProgress(windowEvents),
                adaptiveScheduleAdvisor.recommendSchedule(windowEvents),
                NOW);
    }
}
