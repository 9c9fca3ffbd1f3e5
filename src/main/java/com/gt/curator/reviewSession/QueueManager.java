package com.gt.curator.reviewSession;

import com.gt.curator.model.Item;
import com.gt.curator.model.ScheduleConfig;
import com.gt.curator.reviewSession.model.ReviewQueueEntry;
import com.gt.curator.reviewSession.model.ReviewSession;
import com.gt.curator.reviewSession.model.UrgencyLevel;
import com.gt.curator.scheduling.RetentionEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Builds the ordered list of items for a review session. Items that were already reviewed and have fallen due
 * always take the available slots before new items do.
 */
@Component
public class QueueManager {

    private static final Logger log = LoggerFactory.getLogger(QueueManager.class);

    static final int BASE_REVIEW_SECONDS = 60;
    static final double HARD_ITEM_EASE_FACTOR = 2.0;
    static final double EASY_ITEM_EASE_FACTOR = 2.3;

    private final RetentionEstimator retentionEstimator;
    private final Random random;

    @Autowired
    public QueueManager(RetentionEstimator retentionEstimator) {
        this(retentionEstimator, new Random());
    }

    QueueManager(RetentionEstimator retentionEstimator, Random random) {
        this.retentionEstimator = retentionEstimator;
        this.random = random;
    }

    public ReviewSession buildSession(ScheduleConfig config, Collection<Item> allItems, Instant now) {
        return buildSession(config, allItems, now, 0);
    }

    /**
     * @param newItemsIntroducedToday new items the learner has already started today; they count against
     *                                {@link ScheduleConfig#newItemsPerDay()}
     */
    public ReviewSession buildSession(ScheduleConfig config, Collection<Item> allItems, Instant now, int newItemsIntroducedToday) {
        List<Item> dueItems = new ArrayList<>();
        List<Item> newItems = new ArrayList<>();

        for (Item item : allItems) {
            if (item.isNew()) {
                newItems.add(item);
            } else if (item.nextReviewAt() != null && !item.nextReviewAt().isAfter(now)) {
                dueItems.add(item);
            }
        }

        Map<String, Double> retentionByItemId = new HashMap<>();
        for (Item item : dueItems) {
            retentionByItemId.put(item.id(), retentionEstimator.estimateRetention(item, now));
        }

        List<Item> orderedDueItems = orderDueItems(config, dueItems, retentionByItemId);
        int dailyLimit = Math.max(0, config.dailyReviewLimit());
        List<Item> selectedDueItems = orderedDueItems.subList(0, Math.min(dailyLimit, orderedDueItems.size()));

        int newItemQuota = Math.max(0, config.newItemsPerDay() - newItemsIntroducedToday);
        int newItemSlots = Math.min(newItemQuota, dailyLimit - selectedDueItems.size());
        List<Item> selectedNewItems = newItemSlots <= 0
                ? List.of()
                : orderNewItems(newItems).subList(0, Math.min(newItemSlots, newItems.size()));

        List<ReviewQueueEntry> entries = new ArrayList<>();
        int estimatedSeconds = 0;
        for (Item item : selectedDueItems) {
            ReviewQueueEntry entry = buildEntry(config, item, entries.size() + 1, retentionByItemId.get(item.id()), now);
            estimatedSeconds += entry.estimatedSeconds();
            entries.add(entry);
        }
        for (Item item : selectedNewItems) {
            ReviewQueueEntry entry = buildEntry(config, item, entries.size() + 1, 1.0, now);
            estimatedSeconds += entry.estimatedSeconds();
            entries.add(entry);
        }

        log.debug("Built review session with {} due and {} new items ({} due and {} new available)",
                selectedDueItems.size(), selectedNewItems.size(), dueItems.size(), newItems.size());

        return new ReviewSession(entries, selectedDueItems.size(), selectedNewItems.size(), estimatedSeconds);
    }

    private List<Item> orderDueItems(ScheduleConfig config, List<Item> dueItems, Map<String, Double> retentionByItemId) {
        List<Item> orderedItems = new ArrayList<>(dueItems);
        Comparator<Item> byNextReview = Comparator.comparing(Item::nextReviewAt);

        switch (config.reviewOrder()) {
            case Random -> Collections.shuffle(orderedItems, random);
            case Oldest -> orderedItems.sort(Comparator.comparing(Item::lastReviewAt).thenComparing(byNextReview));
            case Difficulty -> orderedItems.sort(Comparator.comparingDouble(Item::easeFactor).thenComparing(byNextReview));
            default -> orderedItems.sort(Comparator.<Item>comparingDouble(item -> retentionByItemId.get(item.id())).thenComparing(byNextReview));
        }

        return orderedItems;
    }

    // Oldest enrollment first, so every new item is eventually offered
    private static List<Item> orderNewItems(List<Item> newItems) {
        List<Item> orderedItems = new ArrayList<>(newItems);
        orderedItems.sort(Comparator.comparing(Item::enrolledAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Item::id));

        return orderedItems;
    }

    private static ReviewQueueEntry buildEntry(ScheduleConfig config, Item item, int position, double retention, Instant now) {
        UrgencyLevel urgencyLevel = item.isNew()
                ? UrgencyLevel.New
                : UrgencyLevel.fromDaysOverdue(Duration.between(item.nextReviewAt(), now).toDays());
        boolean breakAfter = config.breakInterval() > 0 && position % config.breakInterval() == 0;

        return new ReviewQueueEntry(item.id(), item.itemType(), position, item.isNew(), retention, urgencyLevel,
                item.masteryLevel(), estimateReviewSeconds(item), breakAfter);
    }

    static int estimateReviewSeconds(Item item) {
        double seconds = BASE_REVIEW_SECONDS;

        if (item.easeFactor() < HARD_ITEM_EASE_FACTOR) {
            seconds *= 1.5;
        } else if (item.easeFactor() > EASY_ITEM_EASE_FACTOR) {
            seconds *= 0.8;
        }

        return (int) Math.round(seconds);
    }
}
