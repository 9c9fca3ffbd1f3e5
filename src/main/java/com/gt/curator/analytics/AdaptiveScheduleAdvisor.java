package com.gt.curator.analytics;

import com.gt.curator.analytics.model.*;
import com.gt.curator.model.ReviewEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Mines review history for the hours and weekdays at which the learner recalls best and turns them into a
 * suggested weekly schedule. Read only.
 */
@Component
public class AdaptiveScheduleAdvisor {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveScheduleAdvisor.class);

    static final int MIN_BUCKET_SAMPLE = 3;
    static final int RECOMMENDATION_COUNT = 3;
    static final double POOR_PERFORMANCE_QUALITY = 2.5;
    static final Duration SESSION_GAP = Duration.ofHours(2);
    static final int SESSION_BUCKET_MINUTES = 10;
    static final int MIN_SESSIONS_PER_BUCKET = 3;
    static final int DEFAULT_SESSION_MINUTES = 20;
    static final int MIN_SESSION_MINUTES = 10;
    static final int MAX_SESSION_MINUTES = 60;
    // Shorter session buckets are preferred while within this much of the best success rate
    static final double SUCCESS_RATE_TOLERANCE = 0.05;
    private static final double MINUTES_PER_DAY = 24 * 60;

    private final ZoneId zoneId;

    @Autowired
    public AdaptiveScheduleAdvisor(ZoneId curatorZoneId) {
        this.zoneId = curatorZoneId;
    }

    public ScheduleRecommendations recommendSchedule(Collection<ReviewEvent> events) {
        List<ReviewEvent> sortedEvents = events.stream().sorted(Comparator.comparing(ReviewEvent::submittedAt)).toList();

        List<TimeSlotPerformance> hourPerformance = bucketPerformance(sortedEvents, event -> toZoned(event).getHour())
                .entrySet().stream()
                .map(entry -> TimeSlotPerformance.forHour(entry.getKey(), averageQuality(entry.getValue()), entry.getValue().size()))
                .sorted(Comparator.comparingDouble(TimeSlotPerformance::averageQuality).reversed()
                        .thenComparingInt(TimeSlotPerformance::hour))
                .toList();

        List<TimeSlotPerformance> bestReviewTimes = hourPerformance.stream().limit(RECOMMENDATION_COUNT).toList();
        List<TimeSlotPerformance> avoidTimes = hourPerformance.stream()
                .sorted(Comparator.comparingDouble(TimeSlotPerformance::averageQuality).thenComparingInt(TimeSlotPerformance::hour))
                .limit(RECOMMENDATION_COUNT)
                .filter(slot -> slot.averageQuality() < POOR_PERFORMANCE_QUALITY)
                .toList();

        List<DayPerformance> bestDays = bucketPerformance(sortedEvents, event -> toZoned(event).getDayOfWeek())
                .entrySet().stream()
                .map(entry -> new DayPerformance(entry.getKey(), averageQuality(entry.getValue()), entry.getValue().size()))
                .sorted(Comparator.comparingDouble(DayPerformance::averageQuality).reversed()
                        .thenComparing(DayPerformance::dayOfWeek))
                .limit(RECOMMENDATION_COUNT)
                .toList();

        int optimalSessionMinutes = calculateOptimalSessionMinutes(sortedEvents);

        log.debug("Schedule recommendations from {} events: {} qualifying hours, optimal session {} minutes",
                sortedEvents.size(), hourPerformance.size(), optimalSessionMinutes);

        return new ScheduleRecommendations(
                bestReviewTimes,
                avoidTimes,
                bestDays,
                optimalSessionMinutes,
                buildSuggestedSchedule(sortedEvents, hourPerformance, optimalSessionMinutes),
                calculateConsistencyScore(sortedEvents));
    }

    // Buckets with fewer than MIN_BUCKET_SAMPLE events are dropped
    private static <K> Map<K, List<ReviewEvent>> bucketPerformance(List<ReviewEvent> events, Function<ReviewEvent, K> keyFunction) {
        return events.stream()
                .collect(Collectors.groupingBy(keyFunction))
                .entrySet().stream()
                .filter(entry -> entry.getValue().size() >= MIN_BUCKET_SAMPLE)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    private List<SuggestedSession> buildSuggestedSchedule(List<ReviewEvent> events, List<TimeSlotPerformance> globalHourPerformance, int sessionMinutes) {
        if (globalHourPerformance.isEmpty()) {
            return List.of();
        }

        Map<DayOfWeek, List<ReviewEvent>> eventsByDay = events.stream().collect(Collectors.groupingBy(event -> toZoned(event).getDayOfWeek()));
        TimeSlotPerformance globalBest = globalHourPerformance.get(0);

        List<SuggestedSession> schedule = new ArrayList<>();
        for (DayOfWeek dayOfWeek : DayOfWeek.values()) {
            Optional<TimeSlotPerformance> dayBest = bucketPerformance(eventsByDay.getOrDefault(dayOfWeek, List.of()), event -> toZoned(event).getHour())
                    .entrySet().stream()
                    .map(entry -> TimeSlotPerformance.forHour(entry.getKey(), averageQuality(entry.getValue()), entry.getValue().size()))
                    .max(Comparator.comparingDouble(TimeSlotPerformance::averageQuality)
                            .thenComparing(Comparator.comparingInt(TimeSlotPerformance::hour).reversed()));

            if (dayBest.isPresent()) {
                schedule.add(new SuggestedSession(dayOfWeek, dayBest.get().time(), sessionMinutes, true));
            } else {
                schedule.add(new SuggestedSession(dayOfWeek, globalBest.time(), sessionMinutes, false));
            }
        }

        return schedule;
    }

    /**
     * Groups events into sessions (gaps of at most two hours), buckets sessions by total time spent in 10 minute steps,
     * and returns the shortest bucket whose success rate is within tolerance of the best bucket's.
     */
    int calculateOptimalSessionMinutes(List<ReviewEvent> sortedEvents) {
        Map<Integer, List<List<ReviewEvent>>> sessionsByBucket = new TreeMap<>();
        for (List<ReviewEvent> session : splitIntoSessions(sortedEvents)) {
            long sessionSeconds = session.stream().mapToLong(ReviewEvent::timeSpentSeconds).sum();
            int bucketMinutes = (int) Math.max(1, (long) Math.ceil(sessionSeconds / 60.0 / SESSION_BUCKET_MINUTES)) * SESSION_BUCKET_MINUTES;

            sessionsByBucket.computeIfAbsent(bucketMinutes, bucket -> new ArrayList<>()).add(session);
        }

        Map<Integer, Double> successRateByBucket = new TreeMap<>();
        for (Map.Entry<Integer, List<List<ReviewEvent>>> bucket : sessionsByBucket.entrySet()) {
            if (bucket.getValue().size() >= MIN_SESSIONS_PER_BUCKET) {
                List<ReviewEvent> bucketEvents = bucket.getValue().stream().flatMap(List::stream).toList();
                double successRate = (double) bucketEvents.stream().filter(ReviewEvent::isSuccessful).count() / bucketEvents.size();

                successRateByBucket.put(bucket.getKey(), successRate);
            }
        }

        if (successRateByBucket.isEmpty()) {
            return DEFAULT_SESSION_MINUTES;
        }

        double bestSuccessRate = Collections.max(successRateByBucket.values());
        for (Map.Entry<Integer, Double> bucket : successRateByBucket.entrySet()) {
            if (bucket.getValue() >= bestSuccessRate - SUCCESS_RATE_TOLERANCE) {
                return Math.min(MAX_SESSION_MINUTES, Math.max(MIN_SESSION_MINUTES, bucket.getKey()));
            }
        }

        return DEFAULT_SESSION_MINUTES;
    }

    static List<List<ReviewEvent>> splitIntoSessions(List<ReviewEvent> sortedEvents) {
        List<List<ReviewEvent>> sessions = new ArrayList<>();

        List<ReviewEvent> currentSession = new ArrayList<>();
        ReviewEvent lastEvent = null;
        for (ReviewEvent event : sortedEvents) {
            if (lastEvent != null && Duration.between(lastEvent.submittedAt(), event.submittedAt()).compareTo(SESSION_GAP) > 0) {
                sessions.add(currentSession);
                currentSession = new ArrayList<>();
            }

            currentSession.add(event);
            lastEvent = event;
        }

        if (!currentSession.isEmpty()) {
            sessions.add(currentSession);
        }

        return sessions;
    }

    /**
     * Times of day lie on a 24 hour circle, so 23:55 and 00:05 are ten minutes apart. The score is the mean resultant
     * length of the submission times on that circle scaled to 0-100: 100 when every review happens at the same minute,
     * near 0 when reviews are spread evenly around the clock.
     */
    double calculateConsistencyScore(List<ReviewEvent> events) {
        if (events.size() < 2) {
            return 0;
        }

        double sumCos = 0;
        double sumSin = 0;
        for (ReviewEvent event : events) {
            ZonedDateTime time = toZoned(event);
            double angle = 2 * Math.PI * (time.getHour() * 60 + time.getMinute()) / MINUTES_PER_DAY;

            sumCos += Math.cos(angle);
            sumSin += Math.sin(angle);
        }

        double meanResultantLength = Math.hypot(sumCos, sumSin) / events.size();

        return Math.min(100.0, 100.0 * meanResultantLength);
    }

    private static double averageQuality(List<ReviewEvent> events) {
        return events.stream().mapToInt(ReviewEvent::quality).average().orElse(0);
    }

    private ZonedDateTime toZoned(ReviewEvent event) {
        return event.submittedAt().atZone(zoneId);
    }
}
