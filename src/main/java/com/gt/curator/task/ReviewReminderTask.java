package com.gt.curator.task;

import com.gt.curator.item.ItemService;
import com.gt.curator.model.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Works out, per learner, how many reviews are waiting and when the next one comes due. Delivering a notification
 * is left to whoever reads the log or calls {@link #summarizeLearner}.
 */
@Component
public class ReviewReminderTask {

    private static final Logger log = LoggerFactory.getLogger(ReviewReminderTask.class);

    private final ItemService itemService;

    @Autowired
    public ReviewReminderTask(ItemService itemService) {
        this.itemService = itemService;
    }

    @Scheduled(cron = "${curator.reminder.cron:0 0 * * * *}")
    public void reportDueReviews() {
        Instant now = Instant.now();

        for (String learnerId : itemService.loadLearnerIds()) {
            ReminderSummary summary = summarizeLearner(learnerId, now);

            if (summary.dueCount() > 0) {
                log.info("Learner {} has {} reviews due", learnerId, summary.dueCount());
            } else if (summary.nextDueAt() != null) {
                log.info("Learner {} has no reviews due. Next review due at {}", learnerId, summary.nextDueAt());
            }
        }
    }

    public ReminderSummary summarizeLearner(String learnerId, Instant now) {
        List<Item> reviewedItems = itemService.loadAllItems(learnerId).stream()
                .filter(item -> !item.isNew())
                .filter(item -> item.nextReviewAt() != null)
                .toList();

        int dueCount = (int) reviewedItems.stream()
                .filter(item -> !item.nextReviewAt().isAfter(now))
                .count();

        Optional<Instant> nextDueAt = reviewedItems.stream()
                .map(Item::nextReviewAt)
                .filter(nextReviewAt -> nextReviewAt.isAfter(now))
                .min(Comparator.naturalOrder());

        return new ReminderSummary(learnerId, dueCount, nextDueAt.orElse(null));
    }

    public record ReminderSummary(String learnerId, int dueCount, Instant nextDueAt) { }
}
