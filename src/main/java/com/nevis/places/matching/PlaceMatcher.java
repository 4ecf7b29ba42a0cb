package com.nevis.places.matching;

import com.nevis.places.gazetteer.Gazetteer;
import com.nevis.places.text.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the places whose name or alias starts with the query, either at the
 * beginning of the term or at the beginning of one of its words.
 *
 * <p>Each place yields at most one candidate. A match on the primary name always
 * wins; otherwise the alias the query covers best is used.
 */
@Component
public class PlaceMatcher {

    public List<Candidate> match(Gazetteer gazetteer, String normalizedQuery) {
        if (normalizedQuery == null || normalizedQuery.isEmpty()) {
            return List.of();
        }

        int[] ids = gazetteer.findIdsByPrefix(normalizedQuery);
        List<Candidate> candidates = new ArrayList<>(ids.length);
        for (int id : ids) {
            bestMatch(gazetteer, id, normalizedQuery).ifPresent(candidates::add);
        }
        return candidates;
    }

    private Optional<Candidate> bestMatch(Gazetteer gazetteer, int id, String query) {
        Gazetteer.PlaceTerms terms = gazetteer.terms(id);

        MatchKind nameMatch = matchKind(terms.name(), query, MatchKind.NAME_PREFIX, MatchKind.NAME_WORD);
        if (nameMatch != null) {
            return Optional.of(new Candidate(gazetteer.get(id), terms.name(), query.length(), nameMatch));
        }

        Candidate best = null;
        for (String alias : terms.aliases()) {
            MatchKind aliasMatch = matchKind(alias, query, MatchKind.ALIAS_PREFIX, MatchKind.ALIAS_WORD);
            if (aliasMatch != null && (best == null || alias.length() < best.matchedLength())) {
                best = new Candidate(gazetteer.get(id), alias, query.length(), aliasMatch);
            }
        }
        return Optional.ofNullable(best);
    }

    private static MatchKind matchKind(String term, String query, MatchKind prefix, MatchKind word) {
        if (term.startsWith(query)) {
            return prefix;
        }
        for (int offset : TextNormalizer.wordStarts(term)) {
            if (term.startsWith(query, offset)) {
                return word;
            }
        }
        return null;
    }
}
