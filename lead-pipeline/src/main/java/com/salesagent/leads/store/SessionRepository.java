package com.salesagent.leads.store;

import com.salesagent.leads.model.IngestSession;

import java.util.List;
import java.util.Optional;

public interface SessionRepository {

    Optional<IngestSession> find(String sessionId);

    /**
     * Create the session in UPLOADING, or refresh an UPLOADING one with the new requested count.
     *
     * @throws com.salesagent.leads.exception.SessionClosedException if the session is already terminal
     */
    IngestSession open(String sessionId, int requestedCount);

    /** UPLOADING → COMPLETED. Returns false if the session was not UPLOADING. */
    boolean complete(IngestSession counts);

    /** UPLOADING → FAILED. Returns false if the session was not UPLOADING. */
    boolean fail(IngestSession counts, String lastError);

    List<IngestSession> findRecent(int limit);
}
