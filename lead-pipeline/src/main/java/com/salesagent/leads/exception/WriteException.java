package com.salesagent.leads.exception;

/**
 * The lead store could not be reached. Aborts the whole batch.
 */
public class WriteException extends RuntimeException {

    private final String sessionId;

    public WriteException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
