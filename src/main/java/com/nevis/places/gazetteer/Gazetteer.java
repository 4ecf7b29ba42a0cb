package com.nevis.places.gazetteer;

import com.nevis.places.model.PlaceRecord;
import com.nevis.places.text.TextNormalizer;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable catalog of places together with a sorted index of normalized
 * lookup terms. Every record is indexed under its normalized name, its
 * normalized aliases and every word-start suffix of those, so both prefix and
 * word-start lookups are a single range scan over the term keys.
 *
 * <p>Instances are built once and never mutated, so they can be shared by any
 * number of concurrent readers.
 */
public final class Gazetteer {

    private final String source;
    private final List<PlaceRecord> places;
    private final List<PlaceTerms> terms;
    private final NavigableMap<String, int[]> termIndex;
    private final int skippedRows;

    private Gazetteer(String source,
                      List<PlaceRecord> places,
                      List<PlaceTerms> terms,
                      NavigableMap<String, int[]> termIndex,
                      int skippedRows) {
        this.source = source;
        this.places = places;
        this.terms = terms;
        this.termIndex = termIndex;
        this.skippedRows = skippedRows;
    }

    /**
     * Normalized forms of one record's name and aliases, aligned with the record id.
     */
    public record PlaceTerms(String name, List<String> aliases) {
        public PlaceTerms {
            aliases = List.copyOf(aliases);
        }
    }

    public static Gazetteer of(String source, List<PlaceRecord> places, int skippedRows) {
        Objects.requireNonNull(places, "places");
        List<PlaceRecord> catalog = List.copyOf(places);
        List<PlaceTerms> terms = new ArrayList<>(catalog.size());
        TreeMap<String, List<Integer>> postings = new TreeMap<>();

        for (int id = 0; id < catalog.size(); id++) {
            PlaceRecord place = catalog.get(id);
            if (place.id() != id) {
                throw new IllegalArgumentException(
                    "Place id " + place.id() + " does not match catalog position " + id);
            }

            String name = TextNormalizer.normalize(place.name());
            List<String> aliases = place.aliases().stream()
                .map(TextNormalizer::normalize)
                .filter(alias -> !alias.isEmpty())
                .toList();
            terms.add(new PlaceTerms(name, aliases));

            index(postings, name, id);
            for (String alias : aliases) {
                index(postings, alias, id);
            }
        }

        TreeMap<String, int[]> frozen = new TreeMap<>();
        for (Map.Entry<String, List<Integer>> entry : postings.entrySet()) {
            frozen.put(entry.getKey(), entry.getValue().stream().mapToInt(Integer::intValue).toArray());
        }

        return new Gazetteer(
            source,
            catalog,
            Collections.unmodifiableList(terms),
            Collections.unmodifiableNavigableMap(frozen),
            skippedRows
        );
    }

    private static void index(TreeMap<String, List<Integer>> postings, String term, int id) {
        if (term.isEmpty()) {
            return;
        }
        addPosting(postings, term, id);
        for (int offset : TextNormalizer.wordStarts(term)) {
            addPosting(postings, term.substring(offset), id);
        }
    }

    private static void addPosting(TreeMap<String, List<Integer>> postings, String key, int id) {
        List<Integer> ids = postings.computeIfAbsent(key, k -> new ArrayList<>());
        if (ids.isEmpty() || ids.get(ids.size() - 1) != id) {
            ids.add(id);
        }
    }

    /**
     * Ids of every record with an indexed term starting with the given normalized
     * prefix, in catalog order and without duplicates.
     */
    public int[] findIdsByPrefix(String normalizedPrefix) {
        if (normalizedPrefix == null || normalizedPrefix.isEmpty()) {
            return new int[0];
        }

        BitSet ids = new BitSet(places.size());
        termIndex.subMap(normalizedPrefix, true, normalizedPrefix + Character.MAX_VALUE, false)
            .values()
            .forEach(postings -> {
                for (int id : postings) {
                    ids.set(id);
                }
            });
        return ids.stream().toArray();
    }

    public PlaceRecord get(int id) {
        return places.get(id);
    }

    public PlaceTerms terms(int id) {
        return terms.get(id);
    }

    public List<PlaceRecord> places() {
        return places;
    }

    public int size() {
        return places.size();
    }

    public int termCount() {
        return termIndex.size();
    }

    public int skippedRows() {
        return skippedRows;
    }

    public String source() {
        return source;
    }
}
