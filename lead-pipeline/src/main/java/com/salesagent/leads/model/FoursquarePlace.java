package com.salesagent.leads.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO matching the Foursquare Places search JSON structure.
 * Kept separate from the domain model to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FoursquarePlace {

    @JsonProperty("fsq_place_id")
    private String fsqPlaceId;

    private String name;

    private Location location;

    private List<Category> categories = new ArrayList<>();

    private String tel;

    private String website;

    private String email;

    private Contact contact;

    /** Foursquare scale, 0 to 10 */
    private Double rating;

    private Integer distance;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Location {
        private String address;
        private String locality;
        private String region;
        private String postcode;
        private String country;

        @JsonProperty("formatted_address")
        private String formattedAddress;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Category {
        private String name;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Contact {
        private String phone;
        private String website;
        private String email;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchResponse {
        private List<FoursquarePlace> results = new ArrayList<>();
    }
}
