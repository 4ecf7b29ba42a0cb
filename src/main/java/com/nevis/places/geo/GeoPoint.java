package com.nevis.places.geo;

/**
 * A point on the globe in decimal degrees.
 */
public record GeoPoint(double latitude, double longitude) {

    public GeoPoint {
        if (!GeoValidator.isValidCoordinate(latitude, longitude)) {
            throw new IllegalArgumentException("Invalid coordinate: " + latitude + ", " + longitude);
        }
    }
}
