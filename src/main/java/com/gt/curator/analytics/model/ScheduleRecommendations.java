package com.gt.curator.analytics.model;

import java.util.Collections;
import java.util.List;

public record ScheduleRecommendations(List<TimeSlotPerformance> bestReviewTimes,
                                      List<TimeSlotPerformance> avoidTimes,
                                      List<DayPerformance> bestDays,
                                      int optimalSessionMinutes,
                                      List<SuggestedSession> suggestedSchedule,
                                      double consistencyScore) {

    public ScheduleRecommendations {
        bestReviewTimes = Collections.unmodifiableList(bestReviewTimes);
        avoidTimes = Collections.unmodifiableList(avoidTimes);
        bestDays = Collections.unmodifiableList(bestDays);
        suggestedSchedule = Collections.unmodifiableList(suggestedSchedule);
    }
}
