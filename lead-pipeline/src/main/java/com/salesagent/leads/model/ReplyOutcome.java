package com.salesagent.leads.model;

/**
 * Result of running one inbound reply through the lead-manager flow.
 */
public record ReplyOutcome(String messageId, Status status, boolean hotLead, boolean meetingRequest,
                           String meetingId, String reason) {

    public enum Status { PROCESSED, SKIPPED, DUPLICATE, FAILED }

    public static ReplyOutcome duplicate(String messageId) {
        return new ReplyOutcome(messageId, Status.DUPLICATE, false, false, null, "already processed");
    }

    public static ReplyOutcome skipped(String messageId, String reason) {
        return new ReplyOutcome(messageId, Status.SKIPPED, false, false, null, reason);
    }
}
