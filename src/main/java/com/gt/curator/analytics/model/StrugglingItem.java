package com.gt.curator.analytics.model;

import java.util.List;

public record StrugglingItem(String itemId, List<Integer> recentQualities, double easeFactor) {

    public StrugglingItem {
        recentQualities = List.copyOf(recentQualities);
    }
}
