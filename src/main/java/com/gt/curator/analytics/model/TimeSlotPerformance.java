package com.gt.curator.analytics.model;

public record TimeSlotPerformance(int hour, String time, double averageQuality, int sampleSize) {

    public static TimeSlotPerformance forHour(int hour, double averageQuality, int sampleSize) {
        return new TimeSlotPerformance(hour, String.format("%02d:00", hour), averageQuality, sampleSize);
    }
}
