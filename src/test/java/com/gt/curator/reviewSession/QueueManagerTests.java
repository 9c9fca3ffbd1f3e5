package com.gt.curator.reviewSession;

import com.gt.curator.model.Item;
import com.gt.curator.model.ReviewOrder;
import com.gt.curator.model.ScheduleConfig;
import com.gt.curator.reviewSession.model.ReviewQueueEntry;
import com.gt.curator.reviewSession.model.ReviewSession;
import com.gt.curator.reviewSession.model.UrgencyLevel;
import com.gt.curator.scheduling.RetentionEstimator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static com.gt.curator.util.TestItems.newItem;
import static com.gt.curator.util.TestItems.reviewedItem;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class QueueManagerTests {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    private QueueManager queueManager;

    @BeforeEach
    public void setup() {
        queueManager = new QueueManager(new RetentionEstimator(1.0), new Random(42));
    }

    @Test
    public void testEmptySession() {
        ReviewSession session = queueManager.buildSession(ScheduleConfig.defaults(), List.of(), NOW);

        assertTrue(session.isEmpty());
        assertEquals(0, session.dueItemCount());
        assertEquals(0, session.newItemCount());
        assertEquals(0, session.estimatedSeconds());
    }

    @Test
    public void testDueItemsFillDailyLimitBeforeNewItems() {
        List<Item> items = new ArrayList<>();
        items.addAll(dueItems(30));
        items.addAll(newItems(10));

        ReviewSession session = queueManager.buildSession(ScheduleConfig.defaults(), items, NOW);

        assertEquals(ScheduleConfig.DEFAULT_DAILY_REVIEW_LIMIT, session.entries().size());
        assertEquals(ScheduleConfig.DEFAULT_DAILY_REVIEW_LIMIT, session.dueItemCount());
        assertEquals(0, session.newItemCount());
        assertTrue(session.entries().stream().noneMatch(ReviewQueueEntry::isNew));
    }

    @Test
    public void testNewItemsLimitedPerDay() {
        List<Item> items = new ArrayList<>();
        items.addAll(dueItems(3));
        items.addAll(newItems(10));

        ReviewSession session = queueManager.buildSession(ScheduleConfig.defaults(), items, NOW);

        assertEquals(8, session.entries().size());
        assertEquals(3, session.dueItemCount());
        assertEquals(ScheduleConfig.DEFAULT_NEW_ITEMS_PER_DAY, session.newItemCount());

        for (int i = 0; i < 3; i++) {
            assertFalse(session.entries().get(i).isNew());
        }
        assertEquals(List.of("new-00", "new-01", "new-02", "new-03", "new-04"),
                session.itemIds().subList(3, 8));
    }

    @Test
    public void testNewItemsAlreadyIntroducedTodayReduceQuota() {
        ReviewSession session = queueManager.buildSession(ScheduleConfig.defaults(), newItems(10), NOW, 3);

        assertEquals(2, session.newItemCount());

        ReviewSession exhausted = queueManager.buildSession(ScheduleConfig.defaults(), newItems(10), NOW, 7);

        assertTrue(exhausted.isEmpty());
    }

    @Test
    public void testSessionNeverExceedsLimits() {
        List<Item> items = new ArrayList<>();
        items.addAll(dueItems(8));
        items.addAll(newItems(8));

        for (int limit = 1; limit <= 20; limit++) {
            for (int newPerDay = 0; newPerDay <= 6; newPerDay++) {
                ScheduleConfig config = new ScheduleConfig(limit, newPerDay, ReviewOrder.Urgency, 1.3, List.of(1, 6), 10);

                ReviewSession session = queueManager.buildSession(config, items, NOW);

                assertTrue(session.entries().size() <= limit);
                assertTrue(session.newItemCount() <= newPerDay);
            }
        }
    }

    @Test
    public void testItemsNotYetDueExcluded() {
        Item future = reviewedItem("future", 2.5, 6, 2, NOW.minus(Duration.ofDays(1)));
        Item due = reviewedItem("due", 2.5, 6, 2, NOW.minus(Duration.ofDays(6)));

        ReviewSession session = queueManager.buildSession(ScheduleConfig.defaults(), List.of(future, due), NOW);

        assertEquals(List.of("due"), session.itemIds());
    }

    @Test
    public void testUrgencyOrderPutsLowestRetentionFirst() {
        Item fading = reviewedItem("fading", 2.5, 6, 2, NOW.minus(Duration.ofDays(6)));
        Item forgotten = reviewedItem("forgotten", 2.5, 1, 1, NOW.minus(Duration.ofDays(5)));
        Item slipping = reviewedItem("slipping", 2.5, 10, 3, NOW.minus(Duration.ofDays(11)));

        ReviewSession session = queueManager.buildSession(ScheduleConfig.defaults(), List.of(fading, forgotten, slipping), NOW);

        assertEquals(List.of("forgotten", "slipping", "fading"), session.itemIds());
        for (int i = 1; i < session.entries().size(); i++) {
            assertTrue(session.entries().get(i - 1).retention() <= session.entries().get(i).retention());
        }
    }

    @Test
    public void testDifficultyAndOldestOrders() {
        Item easy = reviewedItem("easy", 2.9, 3, 2, NOW.minus(Duration.ofDays(8)));
        Item hard = reviewedItem("hard", 1.4, 3, 2, NOW.minus(Duration.ofDays(3)));
        Item medium = reviewedItem("medium", 2.2, 3, 2, NOW.minus(Duration.ofDays(5)));
        List<Item> items = List.of(easy, hard, medium);

        ScheduleConfig difficulty = new ScheduleConfig(25, 5, ReviewOrder.Difficulty, 1.3, List.of(1, 6), 10);
        assertEquals(List.of("hard", "medium", "easy"), queueManager.buildSession(difficulty, items, NOW).itemIds());

        ScheduleConfig oldest = new ScheduleConfig(25, 5, ReviewOrder.Oldest, 1.3, List.of(1, 6), 10);
        assertEquals(List.of("easy", "medium", "hard"), queueManager.buildSession(oldest, items, NOW).itemIds());
    }

    @Test
    public void testRandomOrderKeepsSameItems() {
        List<Item> items = dueItems(12);
        ScheduleConfig random = new ScheduleConfig(25, 5, ReviewOrder.Random, 1.3, List.of(1, 6), 10);

        ReviewSession session = queueManager.buildSession(random, items, NOW);

        assertEquals(12, session.entries().size());
        assertEquals(new HashSet<>(items.stream().map(Item::id).toList()), new HashSet<>(session.itemIds()));
    }

    @Test
    public void testRandomOrderChangesBetweenSessions() {
        List<Item> items = dueItems(12);
        ScheduleConfig random = new ScheduleConfig(25, 5, ReviewOrder.Random, 1.3, List.of(1, 6), 10);

        List<String> firstOrder = queueManager.buildSession(random, items, NOW).itemIds();
        List<String> secondOrder = queueManager.buildSession(random, items, NOW).itemIds();
        assertNotEquals(firstOrder, secondOrder);

        QueueManager otherQueueManager = new QueueManager(new RetentionEstimator(1.0), new Random(7));
        List<String> otherOrder = otherQueueManager.buildSession(random, items, NOW).itemIds();
        assertNotEquals(firstOrder, otherOrder);
        assertEquals(new HashSet<>(firstOrder), new HashSet<>(otherOrder));
    }

    @Test
    public void testEntryDetails() {
        Item veryOverdue = reviewedItem("veryOverdue", 1.5, 1, 1, NOW.minus(Duration.ofDays(6)));
        Item overdue = reviewedItem("overdue", 2.2, 1, 1, NOW.minus(Duration.ofDays(3)));
        Item dueToday = reviewedItem("dueToday", 2.5, 21, 4, NOW.minus(Duration.ofDays(21)));
        Item fresh = newItem("fresh", NOW.minus(Duration.ofDays(1)));

        ReviewSession session = queueManager.buildSession(ScheduleConfig.defaults(), List.of(veryOverdue, overdue, dueToday, fresh), NOW);

        assertThat(session.entries()).extracting(ReviewQueueEntry::urgencyLevel)
                .containsExactly(UrgencyLevel.VeryOverdue, UrgencyLevel.Overdue, UrgencyLevel.DueToday, UrgencyLevel.New);
        assertThat(session.entries()).extracting(ReviewQueueEntry::position).containsExactly(1, 2, 3, 4);
        assertThat(session.entries()).extracting(ReviewQueueEntry::estimatedSeconds).containsExactly(90, 60, 48, 48);

        ReviewQueueEntry newEntry = session.entries().get(3);
        assertTrue(newEntry.isNew());
        assertEquals(1.0, newEntry.retention());
        assertEquals(90 + 60 + 48 + 48, session.estimatedSeconds());
    }

    @Test
    public void testBreakAfterEveryBreakInterval() {
        ReviewSession session = queueManager.buildSession(ScheduleConfig.defaults(), dueItems(25), NOW);

        for (ReviewQueueEntry entry : session.entries()) {
            assertEquals(entry.position() % 10 == 0, entry.breakAfter(), "position " + entry.position());
        }
    }

    @Test
    public void testEstimateReviewSeconds() {
        assertEquals(90, QueueManager.estimateReviewSeconds(reviewedItem("hard", 1.9, 1, 1, NOW)));
        assertEquals(60, QueueManager.estimateReviewSeconds(reviewedItem("average", 2.0, 1, 1, NOW)));
        assertEquals(60, QueueManager.estimateReviewSeconds(reviewedItem("average", 2.3, 1, 1, NOW)));
        assertEquals(48, QueueManager.estimateReviewSeconds(reviewedItem("easy", 2.4, 1, 1, NOW)));
    }

    private static List<Item> dueItems(int count) {
        List<Item> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(reviewedItem(String.format("due-%02d", i), 2.5, 1 + i % 5, 2, NOW.minus(Duration.ofDays(1 + i % 5)).minus(Duration.ofHours(i))));
        }

        return items;
    }

    // Enrolled in reverse id order so ordering by enrollment is observable
    private static List<Item> newItems(int count) {
        List<Item> items = new ArrayList<>();
        for (int i = count - 1; i >= 0; i--) {
            items.add(newItem(String.format("new-%02d", i), NOW.minus(Duration.ofDays(count - i))));
        }

        return items;
    }
}
