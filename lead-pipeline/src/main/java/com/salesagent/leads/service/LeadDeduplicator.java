package com.salesagent.leads.service;

import com.salesagent.leads.model.Lead;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses same-identity leads inside one batch.
 *
 * The variant with the most populated optional fields wins (first seen on a tie),
 * then any field it lacks is taken from the other variants in encounter order.
 * Survivors keep the position of their first occurrence.
 */
@Component
@Slf4j
public class LeadDeduplicator {

    public record Result(List<Lead> leads, int duplicatesCollapsed) {}

    public Result deduplicate(List<Lead> leads) {
        Map<String, List<Lead>> groups = new LinkedHashMap<>();
        for (Lead lead : leads) {
            groups.computeIfAbsent(lead.getIdentityKey(), k -> new ArrayList<>()).add(lead);
        }

        List<Lead> survivors = new ArrayList<>(groups.size());
        for (List<Lead> variants : groups.values()) {
            survivors.add(variants.size() == 1 ? variants.get(0) : collapse(variants));
        }

        int collapsed = leads.size() - survivors.size();
        if (collapsed > 0) {
            log.info("Collapsed {} duplicate record(s) into {} lead(s)", collapsed, survivors.size());
        }
        return new Result(survivors, collapsed);
    }

    private Lead collapse(List<Lead> variants) {
        Lead winner = variants.get(0);
        for (Lead candidate : variants) {
            if (candidate.populatedOptionalFields() > winner.populatedOptionalFields()) {
                winner = candidate;
            }
        }

        Lead merged = winner.toBuilder().build();
        for (Lead other : variants) {
            if (other == winner) continue;
            if (merged.getPhone() == null) merged.setPhone(other.getPhone());
            if (merged.getEmail() == null) merged.setEmail(other.getEmail());
            if (merged.getWebsite() == null) merged.setWebsite(other.getWebsite());
            if (merged.getCategory() == null) merged.setCategory(other.getCategory());
            if (merged.getRating() == null) merged.setRating(other.getRating());
        }
        log.debug("Lead {} built from {} variants, winner from {}",
                merged.getIdentityKey(), variants.size(), winner.getSourceProvider());
        return merged;
    }
}
