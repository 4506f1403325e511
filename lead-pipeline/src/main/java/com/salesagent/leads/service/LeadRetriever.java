package com.salesagent.leads.service;

import com.salesagent.leads.config.LeadPipelineProperties;
import com.salesagent.leads.model.Lead;
import com.salesagent.leads.store.LeadStore;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reads a session's leads for the pipeline.
 *
 * Each attempt walks a four-step cascade and stops at the first non-empty result:
 * <ol>
 *   <li>leads tagged with the session that have an email</li>
 *   <li>any lead tagged with the session</li>
 *   <li>most recent leads overall that have an email</li>
 *   <li>most recent leads overall</li>
 * </ol>
 * Steps 3 and 4 can return leads from other sessions. Callers that need strict
 * isolation compare {@link Lead#getSessionId()}.
 */
@Service
@Slf4j
public class LeadRetriever {

    private final LeadStore leadStore;
    private final LeadPipelineProperties properties;
    private final Retry retry;

    public LeadRetriever(LeadStore leadStore, LeadPipelineProperties properties) {
        this.leadStore = leadStore;
        this.properties = properties;

        LeadPipelineProperties.Retrieval retrieval = properties.getRetrieval();
        long backoffMs = Math.max(1, retrieval.getBackoff().toMillis());
        RetryConfig config = RetryConfig.<List<Lead>>custom()
                .maxAttempts(Math.max(1, retrieval.getMaxAttempts()))
                .intervalFunction(attempt -> backoffMs * attempt)
                .retryExceptions(DataAccessException.class)
                .retryOnResult(List::isEmpty)
                .build();
        this.retry = Retry.of("leadRetrieval", config);
        this.retry.getEventPublisher().onRetry(event ->
                log.info("Lead retrieval attempt {} came back empty or failed, retrying in {}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval()));
    }

    public List<Lead> fetchSessionLeads(String sessionId) {
        return fetchSessionLeads(sessionId, properties.getRetrieval().getDefaultLimit());
    }

    public List<Lead> fetchSessionLeads(String sessionId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        List<Lead> leads = Retry.decorateSupplier(retry, () -> cascade(sessionId, limit)).get();
        if (leads.isEmpty()) {
            log.warn("No leads found for session {} after {} attempt(s)",
                    sessionId, properties.getRetrieval().getMaxAttempts());
        }
        return leads;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<Lead> cascade(String sessionId, int limit) {
        List<Lead> leads = leadStore.findBySession(sessionId, true, limit);
        if (!leads.isEmpty()) {
            log.info("Session {}: {} lead(s) via session+email", sessionId, leads.size());
            return leads;
        }
        leads = leadStore.findBySession(sessionId, false, limit);
        if (!leads.isEmpty()) {
            log.info("Session {}: {} lead(s) via session only", sessionId, leads.size());
            return leads;
        }
        leads = leadStore.findRecent(true, limit);
        if (!leads.isEmpty()) {
            log.warn("Session {}: no tagged leads, falling back to {} recent lead(s) with email",
                    sessionId, leads.size());
            return leads;
        }
        leads = leadStore.findRecent(false, limit);
        if (!leads.isEmpty()) {
            log.warn("Session {}: no tagged leads, falling back to {} recent lead(s)", sessionId, leads.size());
        }
        return leads;
    }
}
