package com.gt.curator.analytics.model;

import java.time.DayOfWeek;

/**
 * @param fromDayData true when the time comes from that weekday's own history, false when it falls back to the
 *                    best hour across all days
 */
public record SuggestedSession(DayOfWeek dayOfWeek, String time, int durationMinutes, boolean fromDayData) { }
