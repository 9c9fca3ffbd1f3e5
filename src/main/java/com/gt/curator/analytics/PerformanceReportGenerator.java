package com.gt.curator.analytics;

import com.gt.curator.analytics.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns computed analytics into a report with readable insights, recommendations and an overall grade.
 */
@Component
public class PerformanceReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(PerformanceReportGenerator.class);

    static final double EXCELLENT_SUCCESS_RATE = 0.9;
    static final double LOW_SUCCESS_RATE = 0.7;
    static final int STREAK_INSIGHT_DAYS = 7;
    static final double SLOW_REVIEW_SECONDS = 120;
    static final double LOW_CONSISTENCY_SCORE = 50;
    static final double LOW_MASTERY_RATE = 20;

    static final double SUCCESS_WEIGHT = 0.4;
    static final double CONSISTENCY_WEIGHT = 0.3;
    static final double MASTERY_WEIGHT = 0.3;

    public PerformanceReport generateReport(PerformanceStatistics statistics,
                                            LearningVelocity learningVelocity,
                                            DifficultyAnalysis difficultyAnalysis,
                                            ProgressIndicators progress,
                                            ScheduleRecommendations scheduleRecommendations,
                                            Instant now) {
        double consistencyScore = scheduleRecommendations.consistencyScore();
        PerformanceGrade grade = calculateGrade(statistics.successRate(), consistencyScore, learningVelocity.masteryRate());

        List<String> insights = List.of();
        List<String> recommendations = List.of();
        if (statistics.totalReviews() > 0) {
            insights = buildInsights(statistics, progress, scheduleRecommendations);
            recommendations = buildRecommendations(statistics, learningVelocity, difficultyAnalysis, consistencyScore);
        }

        log.debug("Performance report over {} days: {} reviews, grade {}", statistics.windowDays(), statistics.totalReviews(), grade.getLabel());

        return new PerformanceReport(
                statistics.windowDays(),
                now,
                statistics,
                learningVelocity,
                difficultyAnalysis,
                progress,
                consistencyScore,
                insights,
                recommendations,
                grade);
    }

    // 40% success rate, 30% consistency, 30% mastery rate
    static PerformanceGrade calculateGrade(Double successRate, double consistencyScore, double masteryRate) {
        double score = (successRate == null ? 0 : successRate) * SUCCESS_WEIGHT
                + consistencyScore / 100.0 * CONSISTENCY_WEIGHT
                + masteryRate / 100.0 * MASTERY_WEIGHT;

        return PerformanceGrade.fromScore(score);
    }

    private static List<String> buildInsights(PerformanceStatistics statistics,
                                              ProgressIndicators progress,
                                              ScheduleRecommendations scheduleRecommendations) {
        List<String> insights = new ArrayList<>();

        if (statistics.successRate() > EXCELLENT_SUCCESS_RATE) {
            insights.add("Excellent performance, your success rate is above 90%.");
        } else if (statistics.successRate() < LOW_SUCCESS_RATE) {
            insights.add("Your success rate is below 70%. Consider reviewing items more frequently.");
        }

        if (statistics.currentStreak() >= STREAK_INSIGHT_DAYS) {
            insights.add("You are on a " + statistics.currentStreak() + "-day review streak.");
        }

        if (!scheduleRecommendations.bestReviewTimes().isEmpty()) {
            TimeSlotPerformance bestTime = scheduleRecommendations.bestReviewTimes().get(0);
            insights.add(String.format(Locale.ROOT, "You perform best at %s (average quality %.2f).", bestTime.time(), bestTime.averageQuality()));
        }

        if (progress.trend() == ProgressTrend.Improving) {
            insights.add("Your performance is improving over time.");
        } else if (progress.trend() == ProgressTrend.Declining) {
            insights.add("Your performance has been declining. Consider adjusting your review schedule.");
        }

        return insights;
    }

    private static List<String> buildRecommendations(PerformanceStatistics statistics,
                                                     LearningVelocity learningVelocity,
                                                     DifficultyAnalysis difficultyAnalysis,
                                                     double consistencyScore) {
        List<String> recommendations = new ArrayList<>();

        if (statistics.averageTimeSpentSeconds() > SLOW_REVIEW_SECONDS) {
            recommendations.add("Reviews take over 2 minutes on average. Consider splitting complex items into smaller ones.");
        }
        if (!difficultyAnalysis.strugglingItems().isEmpty()) {
            recommendations.add("You are struggling with " + difficultyAnalysis.strugglingItems().size()
                    + " items. Consider adding notes or examples for them.");
        }
        if (consistencyScore < LOW_CONSISTENCY_SCORE) {
            recommendations.add("Your review times vary a lot. Try to review at the same time every day.");
        }
        if (learningVelocity.masteryRate() < LOW_MASTERY_RATE) {
            recommendations.add("Less than 20% of your items have reached mastery. Focus on quality over quantity when learning new material.");
        }

        return recommendations;
    }
}
