package com.nevis.places;

import com.nevis.places.gazetteer.Gazetteer;
import com.nevis.places.gazetteer.GazetteerLoader;
import org.springframework.core.io.ClassPathResource;

import java.io.StringReader;

public final class GazetteerFixtures {

    public static final String HEADER = "name\taliases\tlatitude\tlongitude\tpopulation\tcountry\tadmin1";

    private GazetteerFixtures() {
    }

    /**
     * The two Londons used by the ranking scenarios.
     */
    public static Gazetteer londons() {
        return fromRows(
            "London\t\t51.5\t-0.1\t8000000\tGB\tENG",
            "London\t\t42.9\t-81.2\t400000\tCA\tON"
        );
    }

    public static Gazetteer places() {
        return new GazetteerLoader().load(new ClassPathResource("gazetteer/places.tsv"));
    }

    public static Gazetteer fromRows(String... rows) {
        return new GazetteerLoader().load(new StringReader(HEADER + "\n" + String.join("\n", rows)), "test");
    }
}
