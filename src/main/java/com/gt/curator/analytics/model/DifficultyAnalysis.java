package com.gt.curator.analytics.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Item counts per {@link DifficultyBand} label, by each item's latest ease factor, plus the items that failed at least
 * two of their last three reviews. The average ease factor is over all reviews in the window and is null when there
 * are none.
 */
public record DifficultyAnalysis(Map<String, Integer> distribution,
                                 List<StrugglingItem> strugglingItems,
                                 Double averageEaseFactor) {

    public DifficultyAnalysis {
        distribution = Collections.unmodifiableMap(distribution);
        strugglingItems = Collections.unmodifiableList(strugglingItems);
    }
}
