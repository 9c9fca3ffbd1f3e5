package com.gt.curator.reviewSession;

import com.gt.curator.model.ReviewEvent;

import java.time.Instant;
import java.util.List;

public interface ReviewEventStore {

    // Returns the event with its store-assigned id
    ReviewEvent appendEvent(ReviewEvent event);

    boolean eventExists(String learnerId, String itemId, Instant submittedAt);

    // Events submitted in [from, to), oldest first
    List<ReviewEvent> loadEvents(String learnerId, Instant from, Instant to);
}
