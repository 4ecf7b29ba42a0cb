package com.nevis.places.service;

import com.nevis.places.geo.GeoPoint;
import com.nevis.places.model.SuggestionResponse;

import java.util.Optional;

public interface SuggestionService {

    SuggestionResponse suggest(String query, Optional<GeoPoint> point);
    SuggestionResponse suggest(String query, Optional<GeoPoint> point, int maxResults);

}
