package com.gt.curator.reviewSession.model;

import com.gt.curator.model.Item;
import com.gt.curator.model.MasteryLevel;
import com.gt.curator.model.ReviewEvent;

/**
 * Result of a review submission. {@code applied} is false when the submission had already been processed, in which
 * case {@code event} is null and {@code item} is the current stored state. Callers that react to mastery transitions
 * check {@code masteryChanged}.
 */
public record ReviewOutcome(Item item,
                            ReviewEvent event,
                            MasteryLevel previousMasteryLevel,
                            MasteryLevel masteryLevel,
                            boolean applied) {

    public boolean masteryChanged() {
        return previousMasteryLevel != masteryLevel;
    }
}
