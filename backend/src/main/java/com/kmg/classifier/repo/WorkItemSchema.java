package com.kmg.classifier.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class WorkItemSchema {
    private static final Logger log = LoggerFactory.getLogger(WorkItemSchema.class);

    private final JdbcTemplate jdbcTemplate;

    public WorkItemSchema(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void initialize() {
        configureSqlitePragmas();

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS work_items (
              id TEXT PRIMARY KEY,
              owner_ref TEXT,
              payload_ref TEXT,
              state TEXT NOT NULL,
              result_label TEXT,
              result_confidence REAL,
              result_scores_json TEXT,
              result_model_version TEXT,
              result_processing_ms INTEGER,
              failure_kind TEXT,
              failure_detail TEXT,
              claim_token TEXT,
              attempts INTEGER NOT NULL DEFAULT 0,
              created_at INTEGER NOT NULL,
              updated_at INTEGER NOT NULL
            )
            """);

        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_work_items_state_created ON work_items(state, created_at)");
        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_work_items_owner_created ON work_items(owner_ref, created_at)");
    }

    private void configureSqlitePragmas() {
        try {
            jdbcTemplate.queryForObject("PRAGMA journal_mode=WAL", String.class);
            jdbcTemplate.execute("PRAGMA synchronous=NORMAL");
        } catch (Exception e) {
            log.warn("Failed to configure SQLite pragmas: {}", e.getMessage());
        }
    }
}
