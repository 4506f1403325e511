package com.salesagent.leads.service;

import com.salesagent.leads.exception.RecordValidationException;
import com.salesagent.leads.model.Lead;
import com.salesagent.leads.model.RawRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Validates raw producer records and maps them to canonical {@link Lead}s.
 *
 * The result carries identity and content only. Session tag, timestamps, status
 * and version are assigned by the writer.
 */
@Component
@Slf4j
public class LeadRecordNormalizer {

    private static final double MIN_RATING = 0.0;
    private static final double MAX_RATING = 5.0;

    // Values some producers put in a field instead of leaving it out
    private static final Set<String> PLACEHOLDERS = Set.of("null", "none", "n/a", "na", "-");

    /**
     * @throws RecordValidationException if a required field is missing, name or address carry nothing
     *                                   to identify the place by, or the rating is unusable
     */
    public Lead normalize(RawRecord raw) {
        if (raw == null) {
            throw new RecordValidationException("record is null");
        }
        String name = identifying(raw.getName(), "name");
        String address = identifying(raw.getAddress(), "address");
        String provider = required(raw.getSourceProvider(), "sourceProvider").toLowerCase(Locale.ROOT);

        return Lead.builder()
                .identityKey(IdentityKeys.identityKey(name, address))
                .name(name)
                .address(address)
                .phone(optional(raw.getPhone()))
                .email(optional(raw.getEmail()))
                .website(optional(raw.getWebsite()))
                .category(optional(raw.getCategory()))
                .rating(parseRating(raw.getRating()))
                .sourceProvider(provider)
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new RecordValidationException(field + " is required");
        }
        return value.trim();
    }

    /** Required, and must keep at least one letter or digit once normalized for identity. */
    private String identifying(String value, String field) {
        String trimmed = required(value, field);
        if (IdentityKeys.normalize(trimmed).isEmpty()) {
            throw new RecordValidationException(field + " has no letters or digits: " + trimmed);
        }
        return trimmed;
    }

    private String optional(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        if (trimmed.isEmpty() || PLACEHOLDERS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return trimmed;
    }

    private Double parseRating(String value) {
        String text = optional(value);
        if (text == null) return null;
        double rating;
        try {
            rating = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new RecordValidationException("rating is not a number: " + text);
        }
        if (Double.isNaN(rating) || rating < MIN_RATING || rating > MAX_RATING) {
            throw new RecordValidationException("rating out of range [0, 5]: " + text);
        }
        return rating;
    }
}
