package com.salesagent.leads.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the tables the service needs if they are missing.
 *
 * DDL sticks to types PostgreSQL and H2 both accept so the same statements
 * run in production and in tests.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StoreSchema {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring lead store schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS leads
            (
                identity_key        VARCHAR(64)   NOT NULL PRIMARY KEY,
                name                VARCHAR(512)  NOT NULL,
                address             VARCHAR(1024) NOT NULL,
                phone               VARCHAR(64),
                email               VARCHAR(320),
                website             VARCHAR(1024),
                category            VARCHAR(256),
                rating              DOUBLE PRECISION,
                source_provider     VARCHAR(64)   NOT NULL,
                session_id          VARCHAR(128),
                created_at          TIMESTAMP     NOT NULL,
                updated_at          TIMESTAMP     NOT NULL,
                status              VARCHAR(32)   NOT NULL,
                version             BIGINT        NOT NULL
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_leads_session ON leads (session_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_leads_created ON leads (created_at)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS ingest_sessions
            (
                session_id          VARCHAR(128)  NOT NULL PRIMARY KEY,
                status              VARCHAR(16)   NOT NULL,
                requested_count     INTEGER       NOT NULL,
                inserted_count      INTEGER       NOT NULL,
                updated_count       INTEGER       NOT NULL,
                verified_count      INTEGER       NOT NULL,
                failed_count        INTEGER       NOT NULL,
                created_at          TIMESTAMP     NOT NULL,
                updated_at          TIMESTAMP     NOT NULL,
                last_error          VARCHAR(2000)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pipeline_runs
            (
                run_id              VARCHAR(64)   NOT NULL PRIMARY KEY,
                session_id          VARCHAR(128),
                lead_id             VARCHAR(64)   NOT NULL,
                lead_name           VARCHAR(512),
                stage               VARCHAR(16)   NOT NULL,
                stage_status        VARCHAR(16)   NOT NULL,
                stage_statuses      VARCHAR(2000),
                branch_decision     VARCHAR(32),
                call_outcome        VARCHAR(16),
                call_id             VARCHAR(128),
                classification_note VARCHAR(4000),
                extracted_email     VARCHAR(320),
                email_sent          BOOLEAN       NOT NULL,
                branch_note         VARCHAR(1000),
                research            VARCHAR(100000),
                draft               VARCHAR(100000),
                proposal            VARCHAR(100000),
                transcript          VARCHAR(100000),
                started_at          TIMESTAMP     NOT NULL,
                completed_at        TIMESTAMP,
                error               VARCHAR(2000)
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_runs_session ON pipeline_runs (session_id)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS processed_keys
            (
                scope               VARCHAR(64)   NOT NULL,
                idem_key            VARCHAR(256)  NOT NULL,
                created_at          TIMESTAMP     NOT NULL,
                PRIMARY KEY (scope, idem_key)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS meetings
            (
                meeting_id          VARCHAR(64)   NOT NULL PRIMARY KEY,
                lead_id             VARCHAR(320)  NOT NULL,
                attendee_email      VARCHAR(320)  NOT NULL,
                title               VARCHAR(512)  NOT NULL,
                start_at            TIMESTAMP     NOT NULL,
                end_at              TIMESTAMP     NOT NULL,
                status              VARCHAR(16)   NOT NULL,
                created_at          TIMESTAMP     NOT NULL
            )
        """);

        log.info("Lead store schema ready.");
    }
}
