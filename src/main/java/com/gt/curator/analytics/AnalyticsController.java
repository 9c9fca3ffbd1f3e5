package com.gt.curator.analytics;

import com.gt.curator.analytics.model.*;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/rest/analytics")
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    public AnalyticsController(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping(value = "/performance", produces = "application/json")
    public PerformanceStatistics getPerformance(@RequestParam(value = "learnerId") String learnerId,
                                                @RequestParam(value = "days", defaultValue = "30") int days) {
        return analyticsService.getPerformanceStatistics(learnerId, days, Instant.now());
    }

    @GetMapping(value = "/report", produces = "application/json")
    public PerformanceReport getReport(@RequestParam(value = "learnerId") String learnerId,
                                       @RequestParam(value = "days", defaultValue = "30") int days) {
        return analyticsService.getPerformanceReport(learnerId, days, Instant.now());
    }

    @GetMapping(value = "/intervals", produces = "application/json")
    public AdaptiveIntervals getAdaptiveIntervals(@RequestParam(value = "learnerId") String learnerId,
                                                  @RequestParam(value = "itemId") String itemId,
                                                  @RequestParam(value = "days", defaultValue = "30") int days) {
        return analyticsService.getAdaptiveIntervals(learnerId, itemId, days, Instant.now());
    }

    @GetMapping(value = "/schedule", produces = "application/json")
    public ScheduleRecommendations getSchedule(@RequestParam(value = "learnerId") String learnerId) {
        return analyticsService.getScheduleRecommendations(learnerId, Instant.now());
    }

    @GetMapping(value = "/forecast", produces = "application/json")
    public List<WorkloadDay> getForecast(@RequestParam(value = "learnerId") String learnerId,
                                         @RequestParam(value = "days", defaultValue = "7") int days) {
        return analyticsService.getWorkloadForecast(learnerId, days, Instant.now());
    }
}
