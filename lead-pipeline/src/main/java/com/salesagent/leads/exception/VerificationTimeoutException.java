package com.salesagent.leads.exception;

import com.salesagent.leads.model.VerificationResult;

public class VerificationTimeoutException extends RuntimeException {

    private final transient VerificationResult result;

    public VerificationTimeoutException(String sessionId, VerificationResult result) {
        super("Session " + sessionId + " not verified (status=" + result.status()
                + ", verifiedCount=" + result.verifiedCount() + ")");
        this.result = result;
    }

    public VerificationResult getResult() {
        return result;
    }
}
