package com.gt.curator.reviewSession;

import com.gt.curator.exception.ValidationException;
import com.gt.curator.model.Item;
import com.gt.curator.model.ItemVersion;
import com.gt.curator.reviewSession.model.ReviewOutcome;
import com.gt.curator.reviewSession.model.ReviewSession;
import com.gt.curator.reviewSession.model.ReviewSubmission;
import com.gt.curator.scheduling.RetentionEstimator;
import com.gt.curator.scheduling.model.RetentionAlert;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/rest/review")
public class ReviewSessionController {

    private final ReviewSessionService reviewSessionService;

    public ReviewSessionController(ReviewSessionService reviewSessionService) {
        this.reviewSessionService = reviewSessionService;
    }

    @GetMapping(value = "/queue", produces = "application/json")
    public ReviewSession getReviewQueue(@RequestParam(value = "learnerId") String learnerId) {
        return reviewSessionService.generateReviewSession(learnerId, Instant.now());
    }

    @PostMapping(value = "/submit", consumes = "application/json", produces = "application/json")
    public ReviewOutcome submitReview(@RequestParam(value = "learnerId") String learnerId,
                                      @RequestBody SubmitReviewRequest request) {
        if (request.quality() == null) {
            throw new ValidationException("A quality between 0 and 5 is required to submit a review");
        }
        if (request.timeSpentSeconds() == null) {
            throw new ValidationException("Time spent is required to submit a review");
        }

        ItemVersion expectedVersion = request.expectedRepetitions() == null
                ? null
                : new ItemVersion(request.expectedRepetitions(), request.expectedNextReviewAt());

        return reviewSessionService.submitReview(learnerId, new ReviewSubmission(
                request.itemId(),
                request.quality(),
                request.timeSpentSeconds(),
                request.submittedAt() != null ? request.submittedAt() : Instant.now(),
                expectedVersion));
    }

    @PostMapping(value = "/enroll", consumes = "application/json", produces = "application/json")
    public Item enrollItem(@RequestParam(value = "learnerId") String learnerId,
                           @RequestBody EnrollItemRequest request) {
        return reviewSessionService.enrollItem(learnerId, request.itemId(), request.itemType(), Instant.now());
    }

    @GetMapping(value = "/alerts", produces = "application/json")
    public List<RetentionAlert> getRetentionAlerts(@RequestParam(value = "learnerId") String learnerId,
                                                   @RequestParam(value = "threshold", defaultValue = "" + RetentionEstimator.DEFAULT_ALERT_THRESHOLD) double threshold) {
        return reviewSessionService.getRetentionAlerts(learnerId, threshold, Instant.now());
    }

    private record SubmitReviewRequest(String itemId,
                                       Integer quality,
                                       Integer timeSpentSeconds,
                                       Instant submittedAt,
                                       Integer expectedRepetitions,
                                       Instant expectedNextReviewAt) { }
    private record EnrollItemRequest(String itemId, String itemType) { }
}
