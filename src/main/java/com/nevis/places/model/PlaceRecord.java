package com.nevis.places.model;

import java.util.List;

public record PlaceRecord(
    int id,
    String name,
    List<String> aliases,
    double latitude,
    double longitude,
    long population,
    String countryCode,
    String adminRegion
) {
    public PlaceRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Place name must not be blank");
        }
        if (population < 0) {
            throw new IllegalArgumentException("Invalid population: " + population);
        }
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}
