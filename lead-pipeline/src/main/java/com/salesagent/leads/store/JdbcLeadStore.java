package com.salesagent.leads.store;

import com.salesagent.leads.model.Lead;
import com.salesagent.leads.model.LeadStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcLeadStore implements LeadStore {

    private static final String COLUMNS = """
            identity_key, name, address, phone, email, website, category, rating,
            source_provider, session_id, created_at, updated_at, status, version""";

    // Placeholder values producers emit when they have no address
    private static final String HAS_EMAIL = """
            email IS NOT NULL AND TRIM(email) <> '' AND LOWER(email) NOT IN ('null', 'n/a', 'none')""";

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<Lead> leadRowMapper = this::mapLead;

    @Override
    public Optional<Lead> findByKey(String identityKey) {
        List<Lead> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM leads WHERE identity_key = ?",
                leadRowMapper, identityKey);
        return rows.stream().findFirst();
    }

    @Override
    public void insert(Lead lead) {
        jdbcTemplate.update("""
                INSERT INTO leads
                (identity_key, name, address, phone, email, website, category, rating,
                 source_provider, session_id, created_at, updated_at, status, version)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                lead.getIdentityKey(),
                lead.getName(),
                lead.getAddress(),
                lead.getPhone(),
                lead.getEmail(),
                lead.getWebsite(),
                lead.getCategory(),
                lead.getRating(),
                lead.getSourceProvider(),
                lead.getSessionId(),
                ts(lead.getCreatedAt()),
                ts(lead.getUpdatedAt()),
                lead.getStatus().name(),
                lead.getVersion());
    }

    @Override
    public boolean compareAndSet(Lead lead, long expectedVersion) {
        int updated = jdbcTemplate.update("""
                UPDATE leads
                SET name = ?, address = ?, phone = ?, email = ?, website = ?, category = ?, rating = ?,
                    source_provider = ?, session_id = ?, updated_at = ?, status = ?, version = ?
                WHERE identity_key = ? AND version = ?
                """,
                lead.getName(),
                lead.getAddress(),
                lead.getPhone(),
                lead.getEmail(),
                lead.getWebsite(),
                lead.getCategory(),
                lead.getRating(),
                lead.getSourceProvider(),
                lead.getSessionId(),
                ts(lead.getUpdatedAt()),
                lead.getStatus().name(),
                expectedVersion + 1,
                lead.getIdentityKey(),
                expectedVersion);
        return updated == 1;
    }

    @Override
    public int countBySession(String sessionId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM leads WHERE session_id = ?", Integer.class, sessionId);
        return count == null ? 0 : count;
    }

    @Override
    public List<Lead> findBySession(String sessionId, boolean requireEmail, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM leads WHERE session_id = ?"
                + (requireEmail ? " AND " + HAS_EMAIL : "")
                + " ORDER BY created_at DESC, identity_key LIMIT ?";
        return jdbcTemplate.query(sql, leadRowMapper, sessionId, limit);
    }

    @Override
    public List<Lead> findRecent(boolean requireEmail, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM leads"
                + (requireEmail ? " WHERE " + HAS_EMAIL : "")
                + " ORDER BY created_at DESC, identity_key LIMIT ?";
        return jdbcTemplate.query(sql, leadRowMapper, limit);
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    private Lead mapLead(ResultSet rs, int rowNum) throws SQLException {
        double rating = rs.getDouble("rating");
        Double ratingOrNull = rs.wasNull() ? null : rating;
        return Lead.builder()
                .identityKey(rs.getString("identity_key"))
                .name(rs.getString("name"))
                .address(rs.getString("address"))
                .phone(rs.getString("phone"))
                .email(rs.getString("email"))
                .website(rs.getString("website"))
                .category(rs.getString("category"))
                .rating(ratingOrNull)
                .sourceProvider(rs.getString("source_provider"))
                .sessionId(rs.getString("session_id"))
                .createdAt(toLocal(rs.getTimestamp("created_at")))
                .updatedAt(toLocal(rs.getTimestamp("updated_at")))
                .status(LeadStatus.valueOf(rs.getString("status")))
                .version(rs.getLong("version"))
                .build();
    }

    static Timestamp ts(LocalDateTime value) {
        return value == null ? null : Timestamp.valueOf(value);
    }

    static LocalDateTime toLocal(Timestamp value) {
        return value == null ? null : value.toLocalDateTime();
    }
}
