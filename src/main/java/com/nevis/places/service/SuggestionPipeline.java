package com.nevis.places.service;

import com.nevis.places.gazetteer.Gazetteer;
import com.nevis.places.geo.GeoPoint;
import com.nevis.places.matching.Candidate;
import com.nevis.places.matching.PlaceMatcher;
import com.nevis.places.model.Suggestion;
import com.nevis.places.ranking.PlaceRanker;
import com.nevis.places.ranking.RankingMode;
import com.nevis.places.scoring.MatchScorer;
import com.nevis.places.text.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Query pipeline: normalize, match, rank, keep the first {@code maxResults}, then score.
 */
@Component
@RequiredArgsConstructor
public class SuggestionPipeline {

    private final PlaceMatcher matcher;
    private final PlaceRanker ranker;
    private final MatchScorer scorer;

    public List<Suggestion> suggest(Gazetteer gazetteer, String query, Optional<GeoPoint> point, int maxResults) {
        Objects.requireNonNull(gazetteer, "gazetteer");
        if (maxResults < 0) {
            throw new IllegalArgumentException("maxResults must not be negative: " + maxResults);
        }
        if (maxResults == 0) {
            return List.of();
        }

        List<Candidate> candidates = matcher.match(gazetteer, TextNormalizer.normalize(query));
        if (candidates.isEmpty()) {
            return List.of();
        }

        return ranker.rank(candidates, RankingMode.from(point)).stream()
            .limit(maxResults)
            .map(candidate -> Suggestion.from(candidate.place(), scorer.score(candidate)))
            .toList();
    }
}
