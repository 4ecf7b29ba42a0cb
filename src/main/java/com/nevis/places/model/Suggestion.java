package com.nevis.places.model;

public record Suggestion(
    String name,
    double latitude,
    double longitude,
    double score,
    String countryCode,
    String adminRegion,
    long population
) {
    public Suggestion {
        if (score < 0 || score > 1) {
            throw new IllegalArgumentException("Invalid suggestion score: " + score);
        }
    }

    public static Suggestion from(PlaceRecord place, double score) {
        return new Suggestion(
            place.name(),
            place.latitude(),
            place.longitude(),
            score,
            place.countryCode(),
            place.adminRegion(),
            place.population()
        );
    }
}
