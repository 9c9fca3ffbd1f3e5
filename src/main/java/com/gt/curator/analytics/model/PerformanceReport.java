package com.gt.curator.analytics.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

public record PerformanceReport(int windowDays,
                                Instant generatedAt,
                                PerformanceStatistics statistics,
                                LearningVelocity learningVelocity,
                                DifficultyAnalysis difficultyAnalysis,
                                ProgressIndicators progress,
                                double consistencyScore,
                                List<String> insights,
                                List<String> recommendations,
                                PerformanceGrade grade) {

    public PerformanceReport {
        insights = Collections.unmodifiableList(insights);
        recommendations = Collections.unmodifiableList(recommendations);
    }
}
