package com.nevis.places.gazetteer;

import com.nevis.places.GazetteerFixtures;
import com.nevis.places.model.PlaceRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GazetteerTest {

    private final Gazetteer gazetteer = GazetteerFixtures.places();

    @Test
    void shouldFindNamesByPrefixInCatalogOrder() {
        assertThat(gazetteer.findIdsByPrefix("lon")).containsExactly(0, 1, 5);
    }

    @Test
    void shouldFindWordStartsInsideNames() {
        assertThat(gazetteer.findIdsByPrefix("jean")).containsExactly(3);
        assertThat(gazetteer.findIdsByPrefix("york")).containsExactly(4);
    }

    @Test
    void shouldFindAliasesWithoutDuplicatingRecords() {
        // "montreal" is both the normalized name and an alias of the same record
        assertThat(gazetteer.findIdsByPrefix("montreal")).containsExactly(2);
        assertThat(gazetteer.findIdsByPrefix("derry")).containsExactly(5);
    }

    @Test
    void shouldReturnNothingForEmptyOrUnknownPrefix() {
        assertThat(gazetteer.findIdsByPrefix("")).isEmpty();
        assertThat(gazetteer.findIdsByPrefix(null)).isEmpty();
        assertThat(gazetteer.findIdsByPrefix("zzzyzx")).isEmpty();
    }

    @Test
    void shouldExposeNormalizedTerms() {
        Gazetteer.PlaceTerms terms = gazetteer.terms(2);

        assertThat(terms.name()).isEqualTo("montreal");
        assertThat(terms.aliases()).containsExactly("montreal", "mtl");
    }

    @Test
    void shouldBeUnmodifiable() {
        List<PlaceRecord> places = gazetteer.places();
        PlaceRecord extra = new PlaceRecord(10, "Extra", List.of(), 0, 0, 0, "XX", "00");

        assertThatThrownBy(() -> places.add(extra)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> places.get(2).aliases().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldRejectIdsThatDoNotMatchPosition() {
        PlaceRecord misplaced = new PlaceRecord(3, "Misplaced", List.of(), 0, 0, 0, "XX", "00");

        assertThatThrownBy(() -> Gazetteer.of("test", List.of(misplaced), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
