package com.gt.curator.userconfig;

import com.gt.curator.conf.CachingConfig;
import com.gt.curator.exception.ValidationException;
import com.gt.curator.model.ReviewOrder;
import com.gt.curator.model.ScheduleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-learner schedule settings, stored as name/value rows and read into a {@link ScheduleConfig}. Settings the
 * learner never changed fall back to the configured defaults.
 */
@Component
public class ScheduleConfigService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleConfigService.class);

    static final String DAILY_REVIEW_LIMIT = "dailyReviewLimit";
    static final String NEW_ITEMS_PER_DAY = "newItemsPerDay";
    static final String REVIEW_ORDER = "reviewOrder";
    static final String MINIMUM_EASE_FACTOR = "minimumEaseFactor";
    static final String INITIAL_INTERVALS = "initialIntervals";
    static final String BREAK_INTERVAL = "breakInterval";

    static final int MAX_DAILY_REVIEW_LIMIT = 100;
    static final int MAX_NEW_ITEMS_PER_DAY = 50;
    static final double LOWEST_MINIMUM_EASE_FACTOR = 1.0;
    static final double HIGHEST_MINIMUM_EASE_FACTOR = 3.0;

    private final ScheduleConfigDao scheduleConfigDao;
    private final ScheduleConfig defaultConfig;

    @Autowired
    public ScheduleConfigService(ScheduleConfigDao scheduleConfigDao,
                                 @Value("${curator.schedule.dailyReviewLimit:25}") int dailyReviewLimit,
                                 @Value("${curator.schedule.newItemsPerDay:5}") int newItemsPerDay,
                                 @Value("${curator.schedule.reviewOrder:urgency}") String reviewOrder,
                                 @Value("${curator.schedule.minimumEaseFactor:1.3}") double minimumEaseFactor,
                                 @Value("${curator.schedule.initialIntervals:1,6}") String initialIntervals,
                                 @Value("${curator.schedule.breakInterval:10}") int breakInterval) {
        this.scheduleConfigDao = scheduleConfigDao;

        this.defaultConfig = new ScheduleConfig(dailyReviewLimit, newItemsPerDay, ReviewOrder.fromId(reviewOrder),
                minimumEaseFactor, parseIntervals(initialIntervals), breakInterval);
    }

    @Cacheable(CachingConfig.SCHEDULE_CONFIGS)
    public ScheduleConfig getScheduleConfig(String learnerId) {
        return toScheduleConfig(scheduleConfigDao.getSettings(learnerId));
    }

    @CacheEvict(value = CachingConfig.SCHEDULE_CONFIGS, key = "#learnerId")
    public ScheduleConfig updateScheduleConfig(String learnerId, ScheduleConfigUpdate update) {
        Map<String, String> settings = new HashMap<>();

        if (update.dailyReviewLimit() != null) {
            settings.put(DAILY_REVIEW_LIMIT, Integer.toString(clamp(update.dailyReviewLimit(), 1, MAX_DAILY_REVIEW_LIMIT)));
        }
        if (update.newItemsPerDay() != null) {
            settings.put(NEW_ITEMS_PER_DAY, Integer.toString(clamp(update.newItemsPerDay(), 0, MAX_NEW_ITEMS_PER_DAY)));
        }
        if (update.reviewOrder() != null) {
            settings.put(REVIEW_ORDER, update.reviewOrder().getId());
        }
        if (update.minimumEaseFactor() != null) {
            double minimumEaseFactor = Math.max(LOWEST_MINIMUM_EASE_FACTOR, Math.min(HIGHEST_MINIMUM_EASE_FACTOR, update.minimumEaseFactor()));
            settings.put(MINIMUM_EASE_FACTOR, Double.toString(minimumEaseFactor));
        }
        if (update.initialIntervals() != null) {
            if (update.initialIntervals().size() != 2) {
                throw new ValidationException("Exactly two initial intervals are required, got " + update.initialIntervals());
            }
            settings.put(INITIAL_INTERVALS, update.initialIntervals().stream()
                    .map(interval -> Integer.toString(Math.max(1, interval)))
                    .collect(Collectors.joining(",")));
        }
        if (update.breakInterval() != null) {
            settings.put(BREAK_INTERVAL, Integer.toString(Math.max(0, update.breakInterval())));
        }

        if (settings.size() > 0) {
            scheduleConfigDao.saveSettings(learnerId, settings);
            log.info("Updated schedule settings {} for learner {}", settings.keySet(), learnerId);
        }

        return toScheduleConfig(scheduleConfigDao.getSettings(learnerId));
    }

    public ScheduleConfig getDefaultConfig() {
        return defaultConfig;
    }

    private ScheduleConfig toScheduleConfig(Map<String, String> settings) {
        try {
            return new ScheduleConfig(
                    settings.containsKey(DAILY_REVIEW_LIMIT) ? Integer.parseInt(settings.get(DAILY_REVIEW_LIMIT)) : defaultConfig.dailyReviewLimit(),
                    settings.containsKey(NEW_ITEMS_PER_DAY) ? Integer.parseInt(settings.get(NEW_ITEMS_PER_DAY)) : defaultConfig.newItemsPerDay(),
                    settings.containsKey(REVIEW_ORDER) ? ReviewOrder.fromId(settings.get(REVIEW_ORDER)) : defaultConfig.reviewOrder(),
                    settings.containsKey(MINIMUM_EASE_FACTOR) ? Double.parseDouble(settings.get(MINIMUM_EASE_FACTOR)) : defaultConfig.minimumEaseFactor(),
                    settings.containsKey(INITIAL_INTERVALS) ? parseIntervals(settings.get(INITIAL_INTERVALS)) : defaultConfig.initialIntervals(),
                    settings.containsKey(BREAK_INTERVAL) ? Integer.parseInt(settings.get(BREAK_INTERVAL)) : defaultConfig.breakInterval());
        } catch (NumberFormatException ex) {
            log.error("Stored schedule settings could not be read: {}", settings);
            throw new ValidationException("Invalid stored schedule settings", ex);
        }
    }

    private static List<Integer> parseIntervals(String intervals) {
        return Arrays.stream(intervals.split(","))
                .map(String::trim)
                .map(Integer::parseInt)
                .toList();
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
