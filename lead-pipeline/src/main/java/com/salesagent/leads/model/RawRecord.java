package com.salesagent.leads.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Untrusted place-like record as emitted by a search producer.
 *
 * Every field is raw text. Nothing here has been validated; the normalizer
 * decides what survives into a {@link Lead}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawRecord {

    private String name;
    private String address;
    private String phone;
    private String email;
    private String website;
    private String category;

    /** Numeric text in [0, 5] when present, e.g. "4.2" */
    private String rating;

    /** Producer tag, e.g. map_search or cluster_search */
    private String sourceProvider;

    /** Provider-specific extras (fsq id, coordinates, ...) carried opaquely */
    @Builder.Default
    private Map<String, String> extras = new LinkedHashMap<>();
}
