package com.salesagent.leads.model;

import java.util.Locale;

/**
 * Closed set of call outcomes produced by the classifier.
 */
public enum BranchDecision {
    AGREED_TO_EMAIL("agreed_to_email"),
    INTERESTED("interested"),
    NOT_INTERESTED("not_interested"),
    ISSUE_APPEARED("issue_appeared"),
    OTHER("other");

    private final String label;

    BranchDecision(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Lenient lookup by label or constant name; anything unrecognised is {@link #OTHER}.
     */
    public static BranchDecision fromLabel(String value) {
        if (value == null || value.isBlank()) return OTHER;
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (BranchDecision d : values()) {
            if (d.label.equals(v)) return d;
        }
        return OTHER;
    }

    public static boolean isKnownLabel(String value) {
        if (value == null) return false;
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (BranchDecision d : values()) {
            if (d.label.equals(v)) return true;
        }
        return false;
    }
}
