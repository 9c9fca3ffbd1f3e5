package com.gt.curator.analytics.model;

import java.time.LocalDate;

public record WorkloadDay(LocalDate date, int count, int cumulative, boolean aboveAverage) { }
