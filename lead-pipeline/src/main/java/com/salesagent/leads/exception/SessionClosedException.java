package com.salesagent.leads.exception;

import com.salesagent.leads.model.SessionStatus;

/**
 * Raised when a write targets a session that already reached a terminal status.
 */
public class SessionClosedException extends IllegalStateException {

    public SessionClosedException(String sessionId, SessionStatus status) {
        super("Session " + sessionId + " is " + status + " and no longer accepts writes");
    }
}
