package com.gt.curator.model;

import java.time.Instant;

// Optimistic concurrency marker. Any processed review changes at least one of the two fields.
public record ItemVersion(int repetitions, Instant nextReviewAt) { }
