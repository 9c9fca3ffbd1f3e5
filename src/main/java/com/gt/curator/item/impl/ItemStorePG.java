package com.gt.curator.item.impl;

import com.gt.curator.item.ItemStore;
import com.gt.curator.model.Item;
import com.gt.curator.model.ItemVersion;
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
import java.util.Optional;

public class ItemStorePG implements ItemStore {

    private static final Logger log = LoggerFactory.getLogger(ItemStorePG.class);

    private static final String ITEM_COLUMNS =
            "id, learner_id, item_type, ease_factor, interval_days, repetitions, last_review_at, next_review_at, enrolled_at ";

    private static final String LOAD_ITEM_SQL =
            "SELECT " + ITEM_COLUMNS +
            "FROM review_item " +
            "WHERE learner_id = :learnerId AND id = :itemId";

    private static final String CREATE_ITEM_SQL =
            "INSERT INTO review_item (" + ITEM_COLUMNS + ") " +
            "VALUES (:id, :learnerId, :itemType, :easeFactor, :intervalDays, :repetitions, :lastReviewAt, :nextReviewAt, :enrolledAt) " +
            "ON CONFLICT (learner_id, id) DO NOTHING";

    private static final String COMPARE_AND_SWAP_SQL =
            "UPDATE review_item " +
            "SET ease_factor = :easeFactor, interval_days = :intervalDays, repetitions = :repetitions, " +
                    "last_review_at = :lastReviewAt, next_review_at = :nextReviewAt " +
            "WHERE learner_id = :learnerId AND id = :id " +
                    "AND repetitions = :expectedRepetitions " +
                    "AND next_review_at IS NOT DISTINCT FROM CAST(:expectedNextReviewAt AS TIMESTAMPTZ)";

    private static final String LOAD_ITEMS_BATCH_SQL =
            "SELECT " + ITEM_COLUMNS +
            "FROM review_item " +
            "WHERE learner_id = :learnerId AND (CAST(:lastItemId AS VARCHAR) IS NULL OR id > :lastItemId) " +
            "ORDER BY id ASC LIMIT :batchSize";

    private static final String LOAD_LEARNER_IDS_SQL =
            "SELECT DISTINCT learner_id FROM review_item";

    private final NamedParameterJdbcTemplate template;

    public ItemStorePG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Optional<Item> getItem(String learnerId, String itemId) {
        return template.query(LOAD_ITEM_SQL, Map.of("learnerId", learnerId, "itemId", itemId), ItemStorePG::getItemFromResultSet)
                .stream()
                .findFirst();
    }

    @Override
    public boolean createItem(Item item) {
        return template.update(CREATE_ITEM_SQL, buildItemParams(item)) > 0;
    }

    @Override
    public Optional<Item> compareAndSwap(String learnerId, String itemId, ItemVersion expectedVersion, Item newItem) {
        MapSqlParameterSource params = buildItemParams(newItem);
        params.addValue("learnerId", learnerId);
        params.addValue("id", itemId);
        params.addValue("expectedRepetitions", expectedVersion.repetitions());
        params.addValue("expectedNextReviewAt", toTimestamp(expectedVersion.nextReviewAt()), Types.TIMESTAMP);

        int rowsUpdated = template.update(COMPARE_AND_SWAP_SQL, params);
        if (rowsUpdated == 0) {
            log.debug("Compare and swap rejected for item {} of learner {}, expected version {}", itemId, learnerId, expectedVersion);
            return Optional.empty();
        }

        return Optional.of(newItem);
    }

    @Override
    public List<Item> loadItemsBatch(String learnerId, String lastItemId, int batchSize) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("learnerId", learnerId);
        params.addValue("lastItemId", lastItemId, Types.VARCHAR);
        params.addValue("batchSize", batchSize);

        return template.query(LOAD_ITEMS_BATCH_SQL, params, ItemStorePG::getItemFromResultSet);
    }

    @Override
    public List<String> loadLearnerIds() {
        return template.queryForList(LOAD_LEARNER_IDS_SQL, Map.of(), String.class);
    }

    private static MapSqlParameterSource buildItemParams(Item item) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", item.id());
        params.addValue("learnerId", item.learnerId());
        params.addValue("itemType", item.itemType(), Types.VARCHAR);
        params.addValue("easeFactor", item.easeFactor());
        params.addValue("intervalDays", item.intervalDays());
        params.addValue("repetitions", item.repetitions());
        params.addValue("lastReviewAt", toTimestamp(item.lastReviewAt()), Types.TIMESTAMP);
        params.addValue("nextReviewAt", toTimestamp(item.nextReviewAt()), Types.TIMESTAMP);
        params.addValue("enrolledAt", toTimestamp(item.enrolledAt()), Types.TIMESTAMP);

        return params;
    }

    private static Item getItemFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new Item(
                rs.getString("id"),
                rs.getString("learner_id"),
                rs.getString("item_type"),
                rs.getDouble("ease_factor"),
                rs.getInt("interval_days"),
                rs.getInt("repetitions"),
                toInstant(rs.getTimestamp("last_review_at")),
                toInstant(rs.getTimestamp("next_review_at")),
                toInstant(rs.getTimestamp("enrolled_at")));
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
