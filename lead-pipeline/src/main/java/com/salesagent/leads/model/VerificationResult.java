package com.salesagent.leads.model;

/**
 * Outcome of waiting for a session's writes to become visible.
 *
 * @param ready         true when downstream stages may read the session
 * @param verifiedCount highest lead count observed while polling
 * @param status        last session status seen, null if the session never appeared
 * @param timedOut      true when the wait ended on the deadline
 * @param polls         number of polls performed
 */
public record VerificationResult(boolean ready, int verifiedCount, SessionStatus status,
                                 boolean timedOut, int polls) {}
