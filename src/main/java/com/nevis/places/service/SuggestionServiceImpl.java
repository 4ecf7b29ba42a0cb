package com.nevis.places.service;

import com.nevis.places.config.GazetteerProperties;
import com.nevis.places.gazetteer.Gazetteer;
import com.nevis.places.geo.GeoPoint;
import com.nevis.places.model.Suggestion;
import com.nevis.places.model.SuggestionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class SuggestionServiceImpl implements SuggestionService {

    private final Gazetteer gazetteer;
    private final SuggestionPipeline pipeline;
    private final GazetteerProperties properties;

    @Override
    public SuggestionResponse suggest(String query, Optional<GeoPoint> point) {
        return suggest(query, point, properties.maxResults());
    }

    @Override
    public SuggestionResponse suggest(String query, Optional<GeoPoint> point, int maxResults) {
        if (query == null || query.isBlank()) {
            log.debug("Blank query, returning no suggestions");
            return SuggestionResponse.empty();
        }

        log.debug("Suggesting places for query: {}, point: {}, maxResults: {}", query, point, maxResults);
        List<Suggestion> suggestions = pipeline.suggest(gazetteer, query, point, maxResults);
        log.debug("Query '{}' produced {} suggestions", query, suggestions.size());
        return new SuggestionResponse(suggestions);
    }
}
