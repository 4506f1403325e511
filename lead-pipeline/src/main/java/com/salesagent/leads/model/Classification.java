package com.salesagent.leads.model;

/**
 * Parsed classifier verdict for one call.
 *
 * @param ambiguous true when the reply could not be parsed and {@code decision} fell back to OTHER
 */
public record Classification(BranchDecision decision, String email, String note, boolean ambiguous) {}
