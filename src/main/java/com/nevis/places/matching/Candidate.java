package com.nevis.places.matching;

import com.nevis.places.model.PlaceRecord;

/**
 * A place that matched one query, with the normalized term it matched through.
 */
public record Candidate(
    PlaceRecord place,
    String matchedTerm,
    int queryLength,
    MatchKind kind
) {
    public Candidate {
        if (queryLength <= 0 || queryLength > matchedTerm.length()) {
            throw new IllegalArgumentException(
                "Query length " + queryLength + " does not fit matched term '" + matchedTerm + "'");
        }
    }

    public int matchedLength() {
        return matchedTerm.length();
    }
}
