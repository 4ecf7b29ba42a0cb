package com.nevis.places.ranking;

import com.nevis.places.geo.GeoDistance;
import com.nevis.places.geo.GeoPoint;
import com.nevis.places.matching.Candidate;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Orders candidates for the active {@link RankingMode}. Ties on the primary key
 * fall back to population (descending), then place name, then catalog id, so the
 * order is fully deterministic.
 */
@Component
public class PlaceRanker {

    static final Comparator<Candidate> BY_POPULATION = Comparator
        .comparingLong((Candidate c) -> c.place().population()).reversed()
        .thenComparing(c -> c.place().name(), String.CASE_INSENSITIVE_ORDER)
        .thenComparingInt(c -> c.place().id());

    private record Ranked(Candidate candidate, double distanceKm) {}

    public List<Candidate> rank(List<Candidate> candidates, RankingMode mode) {
        if (mode instanceof RankingMode.DistanceMode distance) {
            return byDistance(candidates, distance.point());
        }
        return candidates.stream()
            .sorted(BY_POPULATION)
            .toList();
    }

    private List<Candidate> byDistance(List<Candidate> candidates, GeoPoint point) {
        return candidates.stream()
            .map(c -> new Ranked(c, GeoDistance.haversineKm(point, c.place().latitude(), c.place().longitude())))
            .sorted(Comparator.comparingDouble(Ranked::distanceKm)
                .thenComparing(Ranked::candidate, BY_POPULATION))
            .map(Ranked::candidate)
            .toList();
    }
}
