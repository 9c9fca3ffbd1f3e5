package com.gt.curator.reviewSession;

import com.gt.curator.exception.ConflictException;
import com.gt.curator.exception.NotFoundException;
import com.gt.curator.exception.ValidationException;
import com.gt.curator.item.ItemStore;
import com.gt.curator.model.Item;
import com.gt.curator.model.ItemVersion;
import com.gt.curator.model.ReviewEvent;
import com.gt.curator.model.ScheduleConfig;
import com.gt.curator.reviewSession.model.ReviewOutcome;
import com.gt.curator.reviewSession.model.ReviewSubmission;
import com.gt.curator.scheduling.SchedulingModel;
import com.gt.curator.scheduling.SchedulingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies a submitted review to an item. Writes are optimistic: the new state is swapped in only if the item still
 * has the version that was read, and a lost race surfaces as {@link ConflictException} for the caller to retry.
 * The item update and its review event commit together, so a failed event write leaves the item untouched.
 */
@Component
public class ReviewProcessor {

    private static final Logger log = LoggerFactory.getLogger(ReviewProcessor.class);

    private final ItemStore itemStore;
    private final ReviewEventStore reviewEventStore;
    private final SchedulingModel schedulingModel;
    private final TransactionTemplate transactionTemplate;

    @Autowired
    public ReviewProcessor(ItemStore itemStore,
                           ReviewEventStore reviewEventStore,
                           SchedulingModel schedulingModel,
                           TransactionTemplate transactionTemplate) {
        this.itemStore = itemStore;
        this.reviewEventStore = reviewEventStore;
        this.schedulingModel = schedulingModel;
        this.transactionTemplate = transactionTemplate;
    }

    public ReviewOutcome submitReview(String learnerId, ReviewSubmission submission, ScheduleConfig config) {
        validateSubmission(submission);

        // Stored timestamps keep microseconds, duplicate lookups must compare at the same precision
        Instant submittedAt = submission.submittedAt().truncatedTo(ChronoUnit.MICROS);

        return transactionTemplate.execute(status -> applyReview(learnerId, submission, submittedAt, config));
    }

    private ReviewOutcome applyReview(String learnerId, ReviewSubmission submission, Instant submittedAt, ScheduleConfig config) {

        Item currentItem = itemStore.getItem(learnerId, submission.itemId())
                .orElseThrow(() -> new NotFoundException("Item " + submission.itemId() + " does not exist for learner " + learnerId));
        ItemVersion currentVersion = currentItem.version();

        if (submission.expectedVersion() != null && !submission.expectedVersion().equals(currentVersion)) {
            String errMsg = "Item " + submission.itemId() + " was updated since it was read. Expected version "
                    + submission.expectedVersion() + ", found " + currentVersion;

            log.warn(errMsg);
            throw new ConflictException(errMsg);
        }

        if (reviewEventStore.eventExists(learnerId, submission.itemId(), submittedAt)) {
            log.warn("Review of item {} submitted at {} was already processed, ignoring duplicate", submission.itemId(), submittedAt);
            return new ReviewOutcome(currentItem, null, currentItem.masteryLevel(), currentItem.masteryLevel(), false);
        }

        SchedulingResult result = schedulingModel.applyReview(currentItem, submission.quality(), submittedAt, config);
        Item updatedItem = currentItem.withSchedule(result.easeFactor(), result.intervalDays(), result.repetitions(),
                submittedAt, result.nextReviewAt());

        Optional<Item> savedItem = itemStore.compareAndSwap(learnerId, submission.itemId(), currentVersion, updatedItem);
        if (savedItem.isEmpty()) {
            String errMsg = "Concurrent review detected for item " + submission.itemId() + ", re-read the item and retry";

            log.warn(errMsg);
            throw new ConflictException(errMsg);
        }

        ReviewEvent event = reviewEventStore.appendEvent(new ReviewEvent(
                0,
                learnerId,
                currentItem.id(),
                currentItem.itemType(),
                submittedAt,
                submission.quality(),
                submission.timeSpentSeconds(),
                result.intervalDays(),
                result.easeFactor(),
                currentItem.isNew()));

        ReviewOutcome outcome = new ReviewOutcome(savedItem.get(), event, currentItem.masteryLevel(), updatedItem.masteryLevel(), true);
        if (outcome.masteryChanged()) {
            log.info("Item {} of learner {} moved from {} to {}", currentItem.id(), learnerId,
                    outcome.previousMasteryLevel().getLabel(), outcome.masteryLevel().getLabel());
        }

        return outcome;
    }

    private static void validateSubmission(ReviewSubmission submission) {
        Objects.requireNonNull(submission.submittedAt(), "submittedAt");

        if (submission.itemId() == null || submission.itemId().isBlank()) {
            throw new ValidationException("An item id is required to submit a review");
        }
        SchedulingModel.validateQuality(submission.quality());
        if (submission.timeSpentSeconds() < 0) {
            throw new ValidationException("Time spent cannot be negative, got " + submission.timeSpentSeconds());
        }
    }
}
