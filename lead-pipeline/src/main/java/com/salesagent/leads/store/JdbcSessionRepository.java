package com.salesagent.leads.store;

import com.salesagent.leads.exception.SessionClosedException;
import com.salesagent.leads.model.IngestSession;
import com.salesagent.leads.model.SessionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static com.salesagent.leads.store.JdbcLeadStore.toLocal;
import static com.salesagent.leads.store.JdbcLeadStore.ts;

/**
 * Session rows in ingest_sessions.
 *
 * Every status or counter change is guarded by {@code status = 'UPLOADING'}, so a
 * terminal row can only ever have its updated_at bumped.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcSessionRepository implements SessionRepository {

    private static final String COLUMNS = """
            session_id, status, requested_count, inserted_count, updated_count, verified_count,
            failed_count, created_at, updated_at, last_error""";

    private static final int MAX_ERROR_LENGTH = 2000;

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<IngestSession> sessionRowMapper = this::mapSession;

    @Override
    public Optional<IngestSession> find(String sessionId) {
        List<IngestSession> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM ingest_sessions WHERE session_id = ?",
                sessionRowMapper, sessionId);
        return rows.stream().findFirst();
    }

    @Override
    public IngestSession open(String sessionId, int requestedCount) {
        LocalDateTime now = LocalDateTime.now();
        try {
            jdbcTemplate.update("""
                    INSERT INTO ingest_sessions
                    (session_id, status, requested_count, inserted_count, updated_count, verified_count,
                     failed_count, created_at, updated_at, last_error)
                    VALUES (?, ?, ?, 0, 0, 0, 0, ?, ?, NULL)
                    """,
                    sessionId, SessionStatus.UPLOADING.name(), requestedCount, ts(now), ts(now));
            log.info("Session {} opened (requested={})", sessionId, requestedCount);
        } catch (DuplicateKeyException e) {
            int updated = jdbcTemplate.update("""
                    UPDATE ingest_sessions SET requested_count = ?, updated_at = ?
                    WHERE session_id = ? AND status = 'UPLOADING'
                    """,
                    requestedCount, ts(now), sessionId);
            if (updated == 0) {
                IngestSession existing = find(sessionId).orElseThrow(() -> e);
                throw new SessionClosedException(sessionId, existing.getStatus());
            }
            log.info("Session {} re-opened while still UPLOADING (requested={})", sessionId, requestedCount);
        }
        return find(sessionId).orElseThrow(
                () -> new IllegalStateException("Session " + sessionId + " not readable after open"));
    }

    @Override
    public boolean complete(IngestSession counts) {
        return finish(counts, SessionStatus.COMPLETED, null);
    }

    @Override
    public boolean fail(IngestSession counts, String lastError) {
        return finish(counts, SessionStatus.FAILED, truncate(lastError));
    }

    @Override
    public List<IngestSession> findRecent(int limit) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM ingest_sessions ORDER BY created_at DESC LIMIT ?",
                sessionRowMapper, limit);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean finish(IngestSession counts, SessionStatus target, String lastError) {
        int updated = jdbcTemplate.update("""
                UPDATE ingest_sessions
                SET status = ?, inserted_count = ?, updated_count = ?, verified_count = ?, failed_count = ?,
                    updated_at = ?, last_error = ?
                WHERE session_id = ? AND status = 'UPLOADING'
                """,
                target.name(),
                counts.getInsertedCount(),
                counts.getUpdatedCount(),
                counts.getVerifiedCount(),
                counts.getFailedCount(),
                ts(LocalDateTime.now()),
                lastError,
                counts.getSessionId());
        if (updated == 0) {
            log.warn("Session {} was not UPLOADING, {} transition ignored", counts.getSessionId(), target);
            return false;
        }
        log.info("Session {} -> {} (inserted={}, updated={}, verified={}, failed={})",
                counts.getSessionId(), target, counts.getInsertedCount(), counts.getUpdatedCount(),
                counts.getVerifiedCount(), counts.getFailedCount());
        return true;
    }

    private IngestSession mapSession(ResultSet rs, int rowNum) throws SQLException {
        return IngestSession.builder()
                .sessionId(rs.getString("session_id"))
                .status(SessionStatus.valueOf(rs.getString("status")))
                .requestedCount(rs.getInt("requested_count"))
                .insertedCount(rs.getInt("inserted_count"))
                .updatedCount(rs.getInt("updated_count"))
                .verifiedCount(rs.getInt("verified_count"))
                .failedCount(rs.getInt("failed_count"))
                .createdAt(toLocal(rs.getTimestamp("created_at")))
                .updatedAt(toLocal(rs.getTimestamp("updated_at")))
                .lastError(rs.getString("last_error"))
                .build();
    }

    private static String truncate(String value) {
        if (value == null) return null;
        return value.length() <= MAX_ERROR_LENGTH ? value : value.substring(0, MAX_ERROR_LENGTH);
    }
}
