package com.gt.curator.userconfig;

import com.gt.curator.model.ReviewOrder;

import java.util.List;

// Fields left null keep their current value
public record ScheduleConfigUpdate(Integer dailyReviewLimit,
                                   Integer newItemsPerDay,
                                   ReviewOrder reviewOrder,
                                   Double minimumEaseFactor,
                                   List<Integer> initialIntervals,
                                   Integer breakInterval) { }
