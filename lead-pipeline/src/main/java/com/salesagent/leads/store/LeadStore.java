package com.salesagent.leads.store;

import com.salesagent.leads.model.Lead;

import java.util.List;
import java.util.Optional;

/**
 * Durable lead storage. Treated as eventually consistent by its callers.
 */
public interface LeadStore {

    Optional<Lead> findByKey(String identityKey);

    /**
     * Insert a brand new lead.
     *
     * @throws org.springframework.dao.DuplicateKeyException if the key already exists
     */
    void insert(Lead lead);

    /**
     * Replace the stored lead only if its version still equals {@code expectedVersion}.
     * The stored version becomes {@code expectedVersion + 1}.
     *
     * @return false when another writer got there first
     */
    boolean compareAndSet(Lead lead, long expectedVersion);

    int countBySession(String sessionId);

    /** Leads tagged with the session, newest first. */
    List<Lead> findBySession(String sessionId, boolean requireEmail, int limit);

    /** Newest leads regardless of session. */
    List<Lead> findRecent(boolean requireEmail, int limit);
}
