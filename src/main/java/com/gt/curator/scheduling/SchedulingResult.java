package com.gt.curator.scheduling;

import java.time.Instant;

public record SchedulingResult(double easeFactor, int intervalDays, int repetitions, Instant nextReviewAt) { }
