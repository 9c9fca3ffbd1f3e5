package com.gt.curator.reviewSession.model;

import com.gt.curator.model.ItemVersion;

import java.time.Instant;

/**
 * A learner's answer for one item.
 *
 * @param submittedAt     logical submission time; a retried submission must reuse it so it is recognised as a duplicate
 * @param expectedVersion the item version the learner was shown, or null to apply against whatever is current
 */
public record ReviewSubmission(String itemId,
                               int quality,
                               int timeSpentSeconds,
                               Instant submittedAt,
                               ItemVersion expectedVersion) { }
