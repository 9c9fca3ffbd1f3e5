package com.gt.curator.analytics.model;

import java.time.DayOfWeek;

public record DayPerformance(DayOfWeek dayOfWeek, double averageQuality, int sampleSize) { }
