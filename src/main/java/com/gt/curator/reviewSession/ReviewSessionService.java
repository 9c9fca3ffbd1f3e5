package com.gt.curator.reviewSession;

import com.gt.curator.item.ItemService;
import com.gt.curator.model.Item;
import com.gt.curator.model.ReviewEvent;
import com.gt.curator.model.ScheduleConfig;
import com.gt.curator.reviewSession.model.ReviewOutcome;
import com.gt.curator.reviewSession.model.ReviewSession;
import com.gt.curator.reviewSession.model.ReviewSubmission;
import com.gt.curator.scheduling.RetentionEstimator;
import com.gt.curator.scheduling.model.RetentionAlert;
import com.gt.curator.userconfig.ScheduleConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

@Component
public class ReviewSessionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionService.class);

    private final ItemService itemService;
    private final ReviewEventStore reviewEventStore;
    private final ScheduleConfigService scheduleConfigService;
    private final QueueManager queueManager;
    private final ReviewProcessor reviewProcessor;
    private final RetentionEstimator retentionEstimator;
    private final ZoneId zoneId;

    @Autowired
    public ReviewSessionService(ItemService itemService,
                                ReviewEventStore reviewEventStore,
                                ScheduleConfigService scheduleConfigService,
                                QueueManager queueManager,
                                ReviewProcessor reviewProcessor,
                                RetentionEstimator retentionEstimator,
                                ZoneId curatorZoneId) {
        this.itemService = itemService;
        this.reviewEventStore = reviewEventStore;
        this.scheduleConfigService = scheduleConfigService;
        this.queueManager = queueManager;
        this.reviewProcessor = reviewProcessor;
        this.retentionEstimator = retentionEstimator;
        this.zoneId = curatorZoneId;
    }

    public ReviewSession generateReviewSession(String learnerId, Instant now) {
        ScheduleConfig config = scheduleConfigService.getScheduleConfig(learnerId);
        List<Item> allItems = itemService.loadAllItems(learnerId);

        int newItemsIntroducedToday = countNewItemsIntroducedToday(learnerId, now);

        ReviewSession session = queueManager.buildSession(config, allItems, now, newItemsIntroducedToday);
        log.debug("Built session of {} items for learner {} ({} due, {} new)", session.entries().size(), learnerId,
                session.dueItemCount(), session.newItemCount());

        return session;
    }

    public ReviewOutcome submitReview(String learnerId, ReviewSubmission submission) {
        return reviewProcessor.submitReview(learnerId, submission, scheduleConfigService.getScheduleConfig(learnerId));
    }

    public Item enrollItem(String learnerId, String itemId, String itemType, Instant now) {
        return itemService.enroll(learnerId, itemId, itemType, now);
    }

    public List<RetentionAlert> getRetentionAlerts(String learnerId, double threshold, Instant now) {
        return retentionEstimator.getRetentionAlerts(itemService.loadAllItems(learnerId), threshold, now);
    }

    private int countNewItemsIntroducedToday(String learnerId, Instant now) {
        LocalDate today = LocalDate.ofInstant(now, zoneId);
        Instant startOfDay = today.atStartOfDay(zoneId).toInstant();
        Instant startOfTomorrow = today.plusDays(1).atStartOfDay(zoneId).toInstant();

        return (int) reviewEventStore.loadEvents(learnerId, startOfDay, startOfTomorrow)
                .stream()
                .filter(ReviewEvent::firstReview)
                .count();
    }
}
