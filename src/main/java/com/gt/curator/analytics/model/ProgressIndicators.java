package com.gt.curator.analytics.model;

import java.util.Collections;
import java.util.List;

/**
 * Direction of the moving average of review quality over a window.
 *
 * @param trendStrength      absolute difference between the latest and earliest moving averages
 * @param currentPerformance latest moving average quality, null without reviews
 * @param milestones         milestones reached inside the window, oldest first
 */
public record ProgressIndicators(ProgressTrend trend,
                                 double trendStrength,
                                 Double currentPerformance,
                                 List<Milestone> milestones) {

    public ProgressIndicators {
        milestones = Collections.unmodifiableList(milestones);
    }
}
