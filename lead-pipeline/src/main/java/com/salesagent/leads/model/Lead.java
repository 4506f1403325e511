package com.salesagent.leads.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Canonical business lead as stored in the leads table.
 *
 * Schema design notes:
 *  - identity_key is the only uniqueness constraint; it is derived from the
 *    normalised name and address, never from provider ids
 *  - session_id is the tag of the last session that wrote the row
 *  - version backs the compare-and-swap merge
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Lead {

    // ── Identity ────────────────────────────────────────────────────────────
    /** SHA-256 of normalised name + address */
    private String identityKey;

    private String name;
    private String address;

    // ── Optional contact / profile fields ───────────────────────────────────
    private String phone;
    private String email;
    private String website;
    private String category;
    private Double rating;

    // ── Lineage ─────────────────────────────────────────────────────────────
    private String sourceProvider;
    private String sessionId;

    // ── Metadata ────────────────────────────────────────────────────────────
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LeadStatus status;
    private long version;

    /** Number of populated optional fields, used to pick the most complete duplicate. */
    public int populatedOptionalFields() {
        int n = 0;
        if (phone != null) n++;
        if (email != null) n++;
        if (website != null) n++;
        if (category != null) n++;
        if (rating != null) n++;
        return n;
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}
