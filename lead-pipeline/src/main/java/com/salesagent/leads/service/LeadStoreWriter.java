package com.salesagent.leads.service;

import com.salesagent.leads.config.LeadPipelineProperties;
import com.salesagent.leads.exception.RecordValidationException;
import com.salesagent.leads.exception.WriteException;
import com.salesagent.leads.model.IngestSession;
import com.salesagent.leads.model.Lead;
import com.salesagent.leads.model.LeadStatus;
import com.salesagent.leads.model.RawRecord;
import com.salesagent.leads.model.RecordError;
import com.salesagent.leads.model.SessionStatus;
import com.salesagent.leads.model.WriteReport;
import com.salesagent.leads.store.LeadStore;
import com.salesagent.leads.store.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Writes one batch of producer records into the lead store under a session.
 *
 * Lifecycle: the session is opened as UPLOADING before the first lead write and
 * only moves to COMPLETED after an independent re-count sees at least one lead
 * tagged with it. Anything else ends in FAILED.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LeadStoreWriter {

    static final String NO_LEADS_VISIBLE = "no leads visible for session";

    private final LeadStore leadStore;
    private final SessionRepository sessionRepository;
    private final LeadRecordNormalizer normalizer;
    private final LeadDeduplicator deduplicator;
    private final LeadPipelineProperties properties;

    private enum Outcome { INSERTED, UPDATED }

    /**
     * @throws com.salesagent.leads.exception.SessionClosedException if the session is already terminal
     * @throws WriteException if the store becomes unreachable mid-batch
     */
    public WriteReport upsert(String sessionId, List<RawRecord> records) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        List<RawRecord> batch = records == null ? List.of() : records;

        try {
            sessionRepository.open(sessionId, batch.size());
        } catch (DataAccessResourceFailureException e) {
            throw new WriteException(sessionId, "Lead store unreachable while opening session", e);
        }

        // ── Validate ─────────────────────────────────────────────────────────
        List<RecordError> validationErrors = new ArrayList<>();
        List<Lead> accepted = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            RawRecord raw = batch.get(i);
            try {
                accepted.add(normalizer.normalize(raw));
            } catch (RecordValidationException e) {
                String provider = raw == null ? null : raw.getSourceProvider();
                validationErrors.add(new RecordError(i, provider, null, e.getMessage()));
                log.debug("Session {}: record {} from {} rejected: {}", sessionId, i, provider, e.getMessage());
            }
        }
        if (!validationErrors.isEmpty()) {
            log.warn("Session {}: {} of {} record(s) failed validation",
                    sessionId, validationErrors.size(), batch.size());
        }

        // ── Deduplicate ──────────────────────────────────────────────────────
        LeadDeduplicator.Result deduped = deduplicator.deduplicate(accepted);

        // ── Write ────────────────────────────────────────────────────────────
        IngestSession counts = IngestSession.builder().sessionId(sessionId).build();
        List<RecordError> recordErrors = new ArrayList<>();
        List<Lead> leads = deduped.leads();
        for (int i = 0; i < leads.size(); i++) {
            Lead lead = leads.get(i);
            try {
                Outcome outcome = writeOne(sessionId, lead);
                if (outcome == Outcome.INSERTED) {
                    counts.setInsertedCount(counts.getInsertedCount() + 1);
                } else {
                    counts.setUpdatedCount(counts.getUpdatedCount() + 1);
                }
            } catch (DataAccessResourceFailureException e) {
                throw abort(counts, e);
            } catch (RuntimeException e) {
                counts.setFailedCount(counts.getFailedCount() + 1);
                recordErrors.add(new RecordError(i, lead.getSourceProvider(), lead.getIdentityKey(), e.getMessage()));
                log.error("Session {}: write failed for lead {} ({}): {}",
                        sessionId, lead.getIdentityKey(), lead.getName(), e.getMessage());
            }
        }

        // ── Re-count and close ───────────────────────────────────────────────
        int visible;
        try {
            visible = leadStore.countBySession(sessionId);
        } catch (DataAccessResourceFailureException e) {
            throw abort(counts, e);
        }
        counts.setVerifiedCount(visible);

        SessionStatus status;
        if (visible > 0) {
            sessionRepository.complete(counts);
            status = SessionStatus.COMPLETED;
        } else {
            sessionRepository.fail(counts, NO_LEADS_VISIBLE);
            status = SessionStatus.FAILED;
            log.warn("Session {} failed: {}", sessionId, NO_LEADS_VISIBLE);
        }

        WriteReport report = WriteReport.builder()
                .sessionId(sessionId)
                .status(status)
                .requestedCount(batch.size())
                .acceptedCount(accepted.size())
                .duplicatesCollapsed(deduped.duplicatesCollapsed())
                .insertedCount(counts.getInsertedCount())
                .updatedCount(counts.getUpdatedCount())
                .failedCount(counts.getFailedCount())
                .verifiedCount(visible)
                .validationErrors(validationErrors)
                .recordErrors(recordErrors)
                .build();

        log.info("Session {} write finished: status={}, requested={}, accepted={}, collapsed={}, inserted={}, updated={}, failed={}, verified={}",
                sessionId, status, report.getRequestedCount(), report.getAcceptedCount(),
                report.getDuplicatesCollapsed(), report.getInsertedCount(), report.getUpdatedCount(),
                report.getFailedCount(), report.getVerifiedCount());
        return report;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * Compare-and-swap on the row version. A lost insert race is retried as a merge.
     */
    private Outcome writeOne(String sessionId, Lead incoming) {
        int maxAttempts = Math.max(1, properties.getIngestion().getCasMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            LocalDateTime now = LocalDateTime.now();
            Optional<Lead> existing = leadStore.findByKey(incoming.getIdentityKey());

            if (existing.isEmpty()) {
                Lead fresh = incoming.toBuilder()
                        .sessionId(sessionId)
                        .createdAt(now)
                        .updatedAt(now)
                        .status(LeadStatus.NEW)
                        .version(0)
                        .build();
                try {
                    leadStore.insert(fresh);
                    return Outcome.INSERTED;
                } catch (DuplicateKeyException e) {
                    log.debug("Lead {} inserted concurrently, retrying as merge", incoming.getIdentityKey());
                    continue;
                }
            }

            Lead current = existing.get();
            Lead merged = merge(current, incoming, sessionId, now);
            if (leadStore.compareAndSet(merged, current.getVersion())) {
                return Outcome.UPDATED;
            }
            log.debug("Lead {} changed underneath us (attempt {}/{})",
                    incoming.getIdentityKey(), attempt, maxAttempts);
        }
        throw new OptimisticLockingFailureException(
                "gave up after " + maxAttempts + " concurrent modification(s)");
    }

    /** Incoming non-null values win; nulls never erase. Creation time and status are kept. */
    static Lead merge(Lead current, Lead incoming, String sessionId, LocalDateTime now) {
        Lead merged = current.toBuilder().build();
        if (incoming.getName() != null) merged.setName(incoming.getName());
        if (incoming.getAddress() != null) merged.setAddress(incoming.getAddress());
        if (incoming.getPhone() != null) merged.setPhone(incoming.getPhone());
        if (incoming.getEmail() != null) merged.setEmail(incoming.getEmail());
        if (incoming.getWebsite() != null) merged.setWebsite(incoming.getWebsite());
        if (incoming.getCategory() != null) merged.setCategory(incoming.getCategory());
        if (incoming.getRating() != null) merged.setRating(incoming.getRating());
        if (incoming.getSourceProvider() != null) merged.setSourceProvider(incoming.getSourceProvider());
        merged.setSessionId(sessionId);
        merged.setUpdatedAt(now);
        return merged;
    }

    private WriteException abort(IngestSession counts, DataAccessResourceFailureException cause) {
        String sessionId = counts.getSessionId();
        log.error("Session {} aborted, lead store unreachable: {}", sessionId, cause.getMessage(), cause);
        try {
            sessionRepository.fail(counts, "store unreachable: " + cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Session {} could not be marked FAILED: {}", sessionId, e.getMessage());
            cause.addSuppressed(e);
        }
        return new WriteException(sessionId, "Lead store unreachable, batch aborted", cause);
    }
}
