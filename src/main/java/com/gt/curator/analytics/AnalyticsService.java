package com.gt.curator.analytics;

import com.gt.curator.analytics.model.*;
import com.gt.curator.exception.ValidationException;
import com.gt.curator.item.ItemService;
import com.gt.curator.model.Item;
import com.gt.curator.model.ReviewEvent;
import com.gt.curator.reviewSession.ReviewEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Component
public class AnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);

    static final int MAX_DAYS = 3650;

    private final ItemService itemService;
    private final ReviewEventStore reviewEventStore;
    private final PerformanceAnalytics performanceAnalytics;
    private final AdaptiveScheduleAdvisor adaptiveScheduleAdvisor;
    private final WorkloadForecaster workloadForecaster;
    private final PerformanceReportGenerator performanceReportGenerator;
    private final int scheduleLookbackDays;

    @Autowired
    public AnalyticsService(ItemService itemService,
                            ReviewEventStore reviewEventStore,
                            PerformanceAnalytics performanceAnalytics,
                            AdaptiveScheduleAdvisor adaptiveScheduleAdvisor,
                            WorkloadForecaster workloadForecaster,
                            PerformanceReportGenerator performanceReportGenerator,
                            @Value("${curator.analytics.scheduleLookbackDays:90}") int scheduleLookbackDays) {
        this.itemService = itemService;
        this.reviewEventStore = reviewEventStore;
        this.performanceAnalytics = performanceAnalytics;
        this.adaptiveScheduleAdvisor = adaptiveScheduleAdvisor;
        this.workloadForecaster = workloadForecaster;
        this.performanceReportGenerator = performanceReportGenerator;
        this.scheduleLookbackDays = scheduleLookbackDays;
    }

    public PerformanceStatistics getPerformanceStatistics(String learnerId, int windowDays, Instant now) {
        validateDays(windowDays);

        List<ReviewEvent> events = loadEventsUpTo(learnerId, windowDays, now);
        log.debug("Computing performance statistics for learner {} over {} events", learnerId, events.size());

        return performanceAnalytics.computeStatistics(events, itemService.loadAllItems(learnerId), windowDays, now);
    }

    public PerformanceReport getPerformanceReport(String learnerId, int windowDays, Instant now) {
        validateDays(windowDays);

        List<ReviewEvent> windowEvents = PerformanceAnalytics.eventsInWindow(loadEventsUpTo(learnerId, windowDays, now), windowDays, now);
        log.debug("Generating performance report for learner {} over {} events", learnerId, windowEvents.size());

        return performanceReportGenerator.generateReport(
                performanceAnalytics.computeStatistics(windowEvents, itemService.loadAllItems(learnerId), windowDays, now),
                performanceAnalytics.calculateLearningVelocity(windowEvents),
                performanceAnalytics.analyzeDifficulty(windowEvents),
                performanceAnalytics.calculateProgress(windowEvents),
                adaptiveScheduleAdvisor.recommendSchedule(windowEvents),
                now);
    }

    // The learner's success rate and the item's own reviews both come from the last windowDays days
    public AdaptiveIntervals getAdaptiveIntervals(String learnerId, String itemId, int windowDays, Instant now) {
        validateDays(windowDays);

        Item item = itemService.getItem(learnerId, itemId);
        List<ReviewEvent> windowEvents = PerformanceAnalytics.eventsInWindow(loadEventsUpTo(learnerId, windowDays, now), windowDays, now);

        Double successRate = windowEvents.isEmpty()
                ? null
                : (double) windowEvents.stream().filter(ReviewEvent::isSuccessful).count() / windowEvents.size();
        List<ReviewEvent> itemEvents = windowEvents.stream().filter(event -> event.itemId().equals(itemId)).toList();

        return performanceAnalytics.recommendIntervals(item, itemEvents, successRate);
    }

    public ScheduleRecommendations getScheduleRecommendations(String learnerId, Instant now) {
        return adaptiveScheduleAdvisor.recommendSchedule(loadEventsUpTo(learnerId, scheduleLookbackDays, now));
    }

    public List<WorkloadDay> getWorkloadForecast(String learnerId, int horizonDays, Instant now) {
        validateDays(horizonDays);

        return workloadForecaster.forecast(itemService.loadAllItems(learnerId), horizonDays, now, true);
    }

    // Range end is exclusive, so an event submitted exactly at now is still included
    private List<ReviewEvent> loadEventsUpTo(String learnerId, int days, Instant now) {
        return reviewEventStore.loadEvents(learnerId, now.minus(days, ChronoUnit.DAYS), now.plusMillis(1));
    }

    private static void validateDays(int days) {
        if (days <= 0 || days > MAX_DAYS) {
            throw new ValidationException("Number of days must be between 1 and " + MAX_DAYS + ", got " + days);
        }
    }
}
