package com.kmg.classifier.repo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.classifier.model.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store of work items. Every state transition is a single conditional UPDATE, so concurrent
 * callers resolve through SQLite's writer lock: the WHERE clause is the compare, the SET is the swap.
 */
@Repository
public class WorkItemRepository {
    private static final TypeReference<LinkedHashMap<String, Double>> SCORES_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<WorkItem> itemMapper;

    public WorkItemRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.itemMapper = this::mapItem;
    }

    private WorkItem mapItem(ResultSet rs, int rowNum) throws SQLException {
        WorkItemState state = WorkItemState.valueOf(rs.getString("state"));

        ClassificationResult result = null;
        if (state == WorkItemState.DONE) {
            result = new ClassificationResult(
                    rs.getString("result_label"),
                    rs.getDouble("result_confidence"),
                    readScores(rs.getString("result_scores_json")),
                    rs.getString("result_model_version"),
                    rs.getLong("result_processing_ms")
            );
        }

        FailureReason failureReason = null;
        if (state == WorkItemState.FAILED) {
            failureReason = new FailureReason(
                    FailureKind.valueOf(rs.getString("failure_kind")),
                    rs.getString("failure_detail")
            );
        }

        return new WorkItem(
                rs.getString("id"),
                rs.getString("owner_ref"),
                rs.getString("payload_ref"),
                state,
                result,
                failureReason,
                SqlTime.read(rs, "created_at"),
                SqlTime.read(rs, "updated_at"),
                rs.getString("claim_token"),
                rs.getInt("attempts")
        );
    }

    public void create(WorkItem item) {
        if (item.state() != WorkItemState.PENDING) {
            throw new IllegalArgumentException("New work items must be PENDING, got " + item.state());
        }
        int inserted = jdbcTemplate.update(
                """
                INSERT INTO work_items(id, owner_ref, payload_ref, state, claim_token, attempts,
                                       created_at, updated_at)
                VALUES (?, ?, ?, ?, NULL, ?, ?, ?)
                ON CONFLICT(id) DO NOTHING
                """,
                item.id(),
                item.ownerRef(),
                item.payloadRef(),
                item.state().name(),
                item.attempts(),
                SqlTime.toMillis(item.createdAt()),
                SqlTime.toMillis(item.updatedAt())
        );
        if (inserted == 0) {
            throw new DuplicateWorkItemException(item.id());
        }
    }

    public Optional<WorkItem> findById(String id) {
        List<WorkItem> rows = jdbcTemplate.query("SELECT * FROM work_items WHERE id = ?", itemMapper, id);
        return rows.stream().findFirst();
    }

    public WorkItem get(String id) {
        return findById(id).orElseThrow(() -> new WorkItemNotFoundException(id));
    }

    /**
     * @return {@code true} if this call moved the item from PENDING to PROCESSING; {@code false} if the
     * item exists in any other state, in which case nothing was written.
     * @throws WorkItemNotFoundException if no item has this id
     */
    public boolean tryClaim(String id, String claimToken, Instant now) {
        int updated = jdbcTemplate.update(
                """
                UPDATE work_items
                   SET state = 'PROCESSING',
                       claim_token = ?,
                       attempts = attempts + 1,
                       updated_at = ?
                 WHERE id = ? AND state = 'PENDING'
                """,
                claimToken,
                SqlTime.toMillis(now),
                id
        );
        return confirmed(id, updated);
    }

    /**
     * @return {@code false} when the claim is stale: the item is no longer PROCESSING under this token.
     * The stored item is left untouched in that case.
     */
    public boolean commitResult(String id, String claimToken, ClassificationResult result, Instant now) {
        int updated = jdbcTemplate.update(
                """
                UPDATE work_items
                   SET state = 'DONE',
                       result_label = ?,
                       result_confidence = ?,
                       result_scores_json = ?,
                       result_model_version = ?,
                       result_processing_ms = ?,
                       claim_token = NULL,
                       updated_at = ?
                 WHERE id = ? AND state = 'PROCESSING' AND claim_token = ?
                """,
                result.label(),
                result.confidence(),
                writeScores(result.scoreDistribution()),
                result.modelVersion(),
                result.processingTimeMs(),
                SqlTime.toMillis(now),
                id,
                claimToken
        );
        return confirmed(id, updated);
    }

    public boolean commitFailure(String id, String claimToken, FailureReason reason, Instant now) {
        int updated = jdbcTemplate.update(
                """
                UPDATE work_items
                   SET state = 'FAILED',
                       failure_kind = ?,
                       failure_detail = ?,
                       claim_token = NULL,
                       updated_at = ?
                 WHERE id = ? AND state = 'PROCESSING' AND claim_token = ?
                """,
                reason.kind().name(),
                reason.detail(),
                SqlTime.toMillis(now),
                id,
                claimToken
        );
        return confirmed(id, updated);
    }

    /**
     * Hands a claimed item back to PENDING. Same preconditions as {@link #commitResult}.
     */
    public boolean releaseClaim(String id, String claimToken, Instant now) {
        int updated = jdbcTemplate.update(
                """
                UPDATE work_items
                   SET state = 'PENDING',
                       claim_token = NULL,
                       updated_at = ?
                 WHERE id = ? AND state = 'PROCESSING' AND claim_token = ?
                """,
                SqlTime.toMillis(now),
                id,
                claimToken
        );
        return confirmed(id, updated);
    }

    /**
     * Oldest first. Each call runs a fresh query, so callers restart the sequence by calling again.
     */
    public List<WorkItem> listPending(int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM work_items WHERE state = 'PENDING' ORDER BY created_at ASC, id ASC LIMIT ?",
                itemMapper,
                limit
        );
    }

    /**
     * Resets every PROCESSING item last touched before {@code now - olderThan} to PENDING.
     *
     * @return number of items reset
     */
    public int reclaimStale(Duration olderThan, Instant now) {
        Instant threshold = now.minus(olderThan);
        return jdbcTemplate.update(
                """
                UPDATE work_items
                   SET state = 'PENDING',
                       claim_token = NULL,
                       updated_at = ?
                 WHERE state = 'PROCESSING' AND updated_at < ?
                """,
                SqlTime.toMillis(now),
                SqlTime.toMillis(threshold)
        );
    }

    public List<WorkItem> findRecentByOwner(String ownerRef, int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM work_items WHERE owner_ref = ? ORDER BY created_at DESC, id DESC LIMIT ?",
                itemMapper,
                ownerRef,
                limit
        );
    }

    public Map<WorkItemState, Long> countByState() {
        Map<WorkItemState, Long> counts = new EnumMap<>(WorkItemState.class);
        for (WorkItemState state : WorkItemState.values()) {
            counts.put(state, 0L);
        }
        jdbcTemplate.query(
                "SELECT state, COUNT(*) AS total FROM work_items GROUP BY state",
                rs -> {
                    counts.put(WorkItemState.valueOf(rs.getString("state")), rs.getLong("total"));
                }
        );
        return counts;
    }

    public List<LabelStats> findLabelStats() {
        return jdbcTemplate.query(
                """
                SELECT result_label, COUNT(*) AS total, AVG(result_confidence) AS avg_confidence
                  FROM work_items
                 WHERE state = 'DONE'
                 GROUP BY result_label
                 ORDER BY total DESC, result_label ASC
                """,
                (rs, rowNum) -> new LabelStats(
                        rs.getString("result_label"),
                        rs.getLong("total"),
                        rs.getDouble("avg_confidence")
                )
        );
    }

    public DoneAverages findDoneAverages() {
        return jdbcTemplate.queryForObject(
                """
                SELECT AVG(result_confidence) AS avg_confidence, AVG(result_processing_ms) AS avg_processing_ms
                  FROM work_items
                 WHERE state = 'DONE'
                """,
                (rs, rowNum) -> new DoneAverages(
                        rs.getDouble("avg_confidence"),
                        rs.getDouble("avg_processing_ms")
                )
        );
    }

    private boolean confirmed(String id, int updated) {
        if (updated > 0) {
            return true;
        }
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM work_items WHERE id = ?", Integer.class, id);
        if (rows == null || rows == 0) {
            throw new WorkItemNotFoundException(id);
        }
        return false;
    }

    private Map<String, Double> readScores(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, SCORES_TYPE);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse stored score distribution", e);
        }
    }

    private String writeScores(Map<String, Double> scores) {
        try {
            return objectMapper.writeValueAsString(scores);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize score distribution", e);
        }
    }

    public record DoneAverages(
            double avgConfidence,
            double avgProcessingMs
    ) {
    }
}
