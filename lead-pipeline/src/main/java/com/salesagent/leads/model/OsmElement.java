package com.salesagent.leads.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw DTOs for the OpenStreetMap endpoints: Nominatim geocoding and Overpass node queries.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OsmElement {

    private String type;
    private Long id;
    private Double lat;
    private Double lon;
    private Map<String, String> tags = new LinkedHashMap<>();

    public String tag(String key) {
        return tags == null ? null : tags.get(key);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OverpassResponse {
        private List<OsmElement> elements = new ArrayList<>();
    }

    /** Nominatim returns coordinates as strings. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GeocodeResult {
        private String lat;
        private String lon;
        @JsonProperty("display_name")
        private String displayName;
    }
}
