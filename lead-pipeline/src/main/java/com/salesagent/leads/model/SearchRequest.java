package com.salesagent.leads.model;

public record SearchRequest(String query, String location, int radiusMeters, int limit) {

    public SearchRequest {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location is required");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (radiusMeters <= 0) {
            radiusMeters = 2000;
        }
    }
}
