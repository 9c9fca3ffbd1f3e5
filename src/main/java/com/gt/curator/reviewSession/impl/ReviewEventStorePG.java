package com.gt.curator.reviewSession.impl;

import com.gt.curator.exception.DaoException;
import com.gt.curator.model.ReviewEvent;
import com.gt.curator.reviewSession.ReviewEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class ReviewEventStorePG implements ReviewEventStore {

    private static final Logger log = LoggerFactory.getLogger(ReviewEventStorePG.class);

    private static final String INSERT_REVIEW_EVENT_SQL =
            "INSERT INTO review_event " +
                    "(learner_id, item_id, item_type, submitted_at, quality, time_spent_seconds, resulting_interval_days, resulting_ease_factor, first_review) " +
                    "VALUES " +
                    "(:learnerId, :itemId, :itemType, :submittedAt, :quality, :timeSpentSeconds, :resultingIntervalDays, :resultingEaseFactor, :firstReview) " +
                    "RETURNING event_id";

    private static final String COUNT_EVENTS_FOR_SUBMISSION_SQL =
            "SELECT COUNT(*) FROM review_event " +
                    "WHERE learner_id = :learnerId AND item_id = :itemId AND submitted_at = :submittedAt";

    private static final String LOAD_EVENTS_SQL =
            "SELECT event_id, learner_id, item_id, item_type, submitted_at, quality, time_spent_seconds, resulting_interval_days, resulting_ease_factor, first_review " +
                    "FROM review_event " +
                    "WHERE learner_id = :learnerId AND submitted_at >= :from AND submitted_at < :to " +
                    "ORDER BY submitted_at ASC, event_id ASC";

    private final NamedParameterJdbcTemplate template;

    public ReviewEventStorePG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public ReviewEvent appendEvent(ReviewEvent event) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("learnerId", event.learnerId());
        params.addValue("itemId", event.itemId());
        params.addValue("itemType", event.itemType(), Types.VARCHAR);
        params.addValue("submittedAt", Timestamp.from(event.submittedAt()));
        params.addValue("quality", event.quality());
        params.addValue("timeSpentSeconds", event.timeSpentSeconds());
        params.addValue("resultingIntervalDays", event.resultingIntervalDays());
        params.addValue("resultingEaseFactor", event.resultingEaseFactor());
        params.addValue("firstReview", event.firstReview());

        Long eventId = template.queryForObject(INSERT_REVIEW_EVENT_SQL, params, Long.class);
        if (eventId == null) {
            String errMsg = "No event id returned when saving review of item " + event.itemId();

            log.error(errMsg);
            throw new DaoException(errMsg);
        }

        return new ReviewEvent(eventId, event.learnerId(), event.itemId(), event.itemType(), event.submittedAt(), event.quality(),
                event.timeSpentSeconds(), event.resultingIntervalDays(), event.resultingEaseFactor(), event.firstReview());
    }

    @Override
    public boolean eventExists(String learnerId, String itemId, Instant submittedAt) {
        Integer count = template.queryForObject(COUNT_EVENTS_FOR_SUBMISSION_SQL,
                Map.of("learnerId", learnerId,
                        "itemId", itemId,
                        "submittedAt", Timestamp.from(submittedAt)),
                Integer.class);

        return count != null && count > 0;
    }

    @Override
    public List<ReviewEvent> loadEvents(String learnerId, Instant from, Instant to) {
        return template.query(LOAD_EVENTS_SQL,
                Map.of("learnerId", learnerId,
                        "from", Timestamp.from(from),
                        "to", Timestamp.from(to)),
                ReviewEventStorePG::getReviewEventFromResultSet);
    }

    private static ReviewEvent getReviewEventFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new ReviewEvent(
                rs.getLong("event_id"),
                rs.getString("learner_id"),
                rs.getString("item_id"),
                rs.getString("item_type"),
                rs.getTimestamp("submitted_at").toInstant(),
                rs.getInt("quality"),
                rs.getInt("time_spent_seconds"),
                rs.getInt("resulting_interval_days"),
                rs.getDouble("resulting_ease_factor"),
                rs.getBoolean("first_review"));
    }
}
