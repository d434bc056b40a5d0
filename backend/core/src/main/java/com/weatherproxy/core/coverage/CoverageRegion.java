package com.weatherproxy.core.coverage;

/**
 * Inclusive latitude/longitude rectangle.
 */
public record CoverageRegion(
        String name,
        double minLat,
        double maxLat,
        double minLon,
        double maxLon
) {
    public boolean contains(double lat, double lon) {
        return lat >= minLat && lat <= maxLat && lon >= minLon && lon <= maxLon;
    }
}
