package com.gt.curator.reviewSession.model;

import com.gt.curator.model.MasteryLevel;

public record ReviewQueueEntry(String itemId,
                               String itemType,
                               int position,
                               boolean isNew,
                               double retention,
                               UrgencyLevel urgencyLevel,
                               MasteryLevel masteryLevel,
                               int estimatedSeconds,
                               boolean breakAfter) { }
