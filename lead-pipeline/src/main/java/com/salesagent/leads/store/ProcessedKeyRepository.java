package com.salesagent.leads.store;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDateTime;

/**
 * Ledger of side effects already performed, keyed by (scope, key).
 * The primary key does the deduplication.
 */
@Repository
@RequiredArgsConstructor
public class ProcessedKeyRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * @return true if the key was recorded by this call, false if it was already present
     */
    public boolean insertIfAbsent(String scope, String key) {
        try {
            jdbcTemplate.update(
                    "INSERT INTO processed_keys (scope, idem_key, created_at) VALUES (?, ?, ?)",
                    scope, key, Timestamp.valueOf(LocalDateTime.now()));
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public boolean exists(String scope, String key) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM processed_keys WHERE scope = ? AND idem_key = ?",
                Integer.class, scope, key);
        return count != null && count > 0;
    }

    public void delete(String scope, String key) {
        jdbcTemplate.update("DELETE FROM processed_keys WHERE scope = ? AND idem_key = ?", scope, key);
    }
}
