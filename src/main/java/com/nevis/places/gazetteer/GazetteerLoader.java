package com.nevis.places.gazetteer;

import com.nevis.places.exception.GazetteerLoadException;
import com.nevis.places.exception.MalformedRecordException;
import com.nevis.places.geo.GeoValidator;
import com.nevis.places.model.PlaceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads a tab-separated place file whose first line names the columns.
 *
 * <p>Rows that fail validation are logged and skipped; only an unreadable source
 * or an unusable header fails the load.
 */
@Slf4j
@Component
public class GazetteerLoader {

    private static final String FIELD_SEPARATOR = "\t";
    private static final String ALIAS_SEPARATOR = ",";

    public Gazetteer load(Resource resource) {
        String source = resource.getDescription();
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            return read(new BufferedReader(reader), source);
        } catch (IOException e) {
            throw new GazetteerLoadException(source, e);
        }
    }

    public Gazetteer load(Path path) {
        String source = path.toString();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, source);
        } catch (IOException e) {
            throw new GazetteerLoadException(source, e);
        }
    }

    public Gazetteer load(Reader reader, String source) {
        try {
            return read(reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader), source);
        } catch (IOException e) {
            throw new GazetteerLoadException(source, e);
        }
    }

    private Gazetteer read(BufferedReader reader, String source) throws IOException {
        String header = reader.readLine();
        if (header == null) {
            throw new GazetteerLoadException(source, "missing header line");
        }
        ColumnLayout layout = ColumnLayout.fromHeader(header, source);

        List<PlaceRecord> places = new ArrayList<>();
        int skipped = 0;
        int lineNumber = 1;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                places.add(parseRow(line.split(FIELD_SEPARATOR, -1), lineNumber, places.size(), layout));
            } catch (MalformedRecordException e) {
                skipped++;
                log.warn("Skipping malformed row in {}: {}", source, e.getMessage());
            }
        }

        Gazetteer gazetteer = Gazetteer.of(source, places, skipped);
        log.info("Loaded gazetteer from {}: {} places, {} rows skipped, {} terms indexed",
            source, gazetteer.size(), skipped, gazetteer.termCount());
        return gazetteer;
    }

    private PlaceRecord parseRow(String[] fields, int lineNumber, int id, ColumnLayout layout) {
        if (fields.length <= layout.lastRequiredIndex()) {
            throw new MalformedRecordException(lineNumber,
                "expected at least " + (layout.lastRequiredIndex() + 1) + " fields but found " + fields.length);
        }

        String name = fields[layout.name()].trim();
        if (name.isEmpty()) {
            throw new MalformedRecordException(lineNumber, "name is empty");
        }

        double latitude = parseCoordinate(fields[layout.latitude()], "latitude", lineNumber);
        double longitude = parseCoordinate(fields[layout.longitude()], "longitude", lineNumber);
        if (!GeoValidator.isValidLatitude(latitude)) {
            throw new MalformedRecordException(lineNumber, "latitude out of range: " + latitude);
        }
        if (!GeoValidator.isValidLongitude(longitude)) {
            throw new MalformedRecordException(lineNumber, "longitude out of range: " + longitude);
        }

        return new PlaceRecord(
            id,
            name,
            parseAliases(fields, layout, name),
            latitude,
            longitude,
            parsePopulation(fields[layout.population()], lineNumber),
            fields[layout.country()].trim(),
            fields[layout.adminRegion()].trim()
        );
    }

    private double parseCoordinate(String raw, String column, int lineNumber) {
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new MalformedRecordException(lineNumber, column + " is not a finite number: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(lineNumber, column + " is not numeric: '" + raw + "'");
        }
    }

    private long parsePopulation(String raw, int lineNumber) {
        String value = raw.trim();
        if (value.isEmpty()) {
            return 0L;
        }
        try {
            long population = Long.parseLong(value);
            if (population < 0) {
                throw new MalformedRecordException(lineNumber, "population is negative: " + population);
            }
            return population;
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(lineNumber, "population is not numeric: '" + raw + "'");
        }
    }

    private List<String> parseAliases(String[] fields, ColumnLayout layout, String name) {
        Set<String> aliases = new LinkedHashSet<>();
        for (String alias : fields[layout.alternateNames()].split(ALIAS_SEPARATOR)) {
            String trimmed = alias.trim();
            if (!trimmed.isEmpty() && !trimmed.equals(name)) {
                aliases.add(trimmed);
            }
        }
        if (layout.asciiName() >= 0 && layout.asciiName() < fields.length) {
            String ascii = fields[layout.asciiName()].trim();
            if (!ascii.isEmpty() && !ascii.equals(name)) {
                aliases.add(ascii);
            }
        }
        return List.copyOf(aliases);
    }

    /**
     * Positions of the columns the loader reads, resolved from the header line.
     * {@code asciiName} is -1 when the file carries no ascii column.
     */
    record ColumnLayout(
        int name,
        int alternateNames,
        int asciiName,
        int latitude,
        int longitude,
        int population,
        int country,
        int adminRegion
    ) {
        private static final List<String> NAME = List.of("name");
        private static final List<String> ALTERNATE_NAMES = List.of("alt_name", "alternatenames", "alternate_names", "aliases");
        private static final List<String> ASCII_NAME = List.of("ascii", "asciiname");
        private static final List<String> LATITUDE = List.of("lat", "latitude");
        private static final List<String> LONGITUDE = List.of("long", "lon", "lng", "longitude");
        private static final List<String> POPULATION = List.of("population");
        private static final List<String> COUNTRY = List.of("country", "country_code", "countrycode");
        private static final List<String> ADMIN_REGION = List.of("admin1", "admin_region", "admin1_code");

        static ColumnLayout fromHeader(String header, String source) {
            String[] columns = header.replace("\uFEFF", "").split(FIELD_SEPARATOR, -1);
            List<String> names = new ArrayList<>(columns.length);
            for (String column : columns) {
                names.add(column.trim().toLowerCase(Locale.ROOT));
            }

            return new ColumnLayout(
                require(names, NAME, source),
                require(names, ALTERNATE_NAMES, source),
                find(names, ASCII_NAME),
                require(names, LATITUDE, source),
                require(names, LONGITUDE, source),
                require(names, POPULATION, source),
                require(names, COUNTRY, source),
                require(names, ADMIN_REGION, source)
            );
        }

        int lastRequiredIndex() {
            return Math.max(Math.max(Math.max(name, alternateNames), Math.max(latitude, longitude)),
                Math.max(population, Math.max(country, adminRegion)));
        }

        private static int require(List<String> names, List<String> accepted, String source) {
            int index = find(names, accepted);
            if (index < 0) {
                throw new GazetteerLoadException(source, "header has no column named any of " + accepted);
            }
            return index;
        }

        private static int find(List<String> names, List<String> accepted) {
            for (String candidate : accepted) {
                int index = names.indexOf(candidate);
                if (index >= 0) {
                    return index;
                }
            }
            return -1;
        }
    }
}
