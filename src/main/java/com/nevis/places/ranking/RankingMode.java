package com.nevis.places.ranking;

import com.nevis.places.geo.GeoPoint;

import java.util.Objects;
import java.util.Optional;

/**
 * How candidates are ordered: nearest to a point first, or most populous first.
 */
public sealed interface RankingMode permits RankingMode.DistanceMode, RankingMode.PopulationMode {

    record DistanceMode(GeoPoint point) implements RankingMode {
        public DistanceMode {
            Objects.requireNonNull(point, "point");
        }
    }

    record PopulationMode() implements RankingMode {
    }

    static RankingMode byDistanceFrom(GeoPoint point) {
        return new DistanceMode(point);
    }

    static RankingMode byPopulation() {
        return new PopulationMode();
    }

    static RankingMode from(Optional<GeoPoint> point) {
        return point.<RankingMode>map(DistanceMode::new).orElseGet(PopulationMode::new);
    }
}
