package com.nevis.places.model;

import java.util.List;

public record SuggestionResponse(
    List<Suggestion> suggestions
) {
    public SuggestionResponse {
        suggestions = List.copyOf(suggestions);
    }

    public static SuggestionResponse empty() {
        return new SuggestionResponse(List.of());
    }

    public boolean found() {
        return !suggestions.isEmpty();
    }
}
