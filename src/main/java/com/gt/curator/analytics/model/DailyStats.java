package com.gt.curator.analytics.model;

import java.time.LocalDate;

public record DailyStats(LocalDate date, int reviewsCount, int successfulCount, double successRate) { }
