package com.gt.curator.reviewSession.model;

import java.util.Collections;
import java.util.List;

public record ReviewSession(List<ReviewQueueEntry> entries, int dueItemCount, int newItemCount, int estimatedSeconds) {

    public ReviewSession {
        entries = Collections.unmodifiableList(entries);
    }

    public List<String> itemIds() {
        return entries.stream().map(ReviewQueueEntry::itemId).toList();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
