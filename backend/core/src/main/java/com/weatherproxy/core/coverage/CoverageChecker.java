package com.weatherproxy.core.coverage;

import java.util.List;
import java.util.Optional;

/**
 * Approximates the area served by the National Weather Service: the United States and its territories.
 */
public final class CoverageChecker {
    public static final List<CoverageRegion> REGIONS = List.of(
            new CoverageRegion("Continental US", 25, 50, -125, -65),
            new CoverageRegion("Alaska", 50, 75, -180, -140),
            new CoverageRegion("Hawaii", 19, 23, -162, -154),
            new CoverageRegion("Puerto Rico/Caribbean", 15, 20, -80, -68)
    );

    private CoverageChecker() {
    }

    public static boolean isCovered(double lat, double lon) {
        return regionFor(lat, lon).isPresent();
    }

    public static Optional<CoverageRegion> regionFor(double lat, double lon) {
        for (CoverageRegion region : REGIONS) {
            if (region.contains(lat, lon)) {
                return Optional.of(region);
            }
        }
        return Optional.empty();
    }
}
