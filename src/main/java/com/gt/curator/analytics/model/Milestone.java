package com.gt.curator.analytics.model;

import java.time.Instant;

public record Milestone(String type, Instant achievedAt, String description) {

    public static final String FIRST_SUCCESS = "first_success";
    public static final String FIRST_PERFECT = "first_perfect";

    public static Milestone reviewCount(int reviewCount, Instant achievedAt) {
        return new Milestone("reviews_" + reviewCount, achievedAt, "Completed " + reviewCount + " reviews");
    }
}
