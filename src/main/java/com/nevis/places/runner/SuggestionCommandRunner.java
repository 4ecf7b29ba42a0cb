package com.nevis.places.runner;

import com.nevis.places.exception.InvalidParameterException;
import com.nevis.places.exception.MissingParameterException;
import com.nevis.places.geo.GeoPoint;
import com.nevis.places.geo.GeoValidator;
import com.nevis.places.model.Suggestion;
import com.nevis.places.model.SuggestionResponse;
import com.nevis.places.service.SuggestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Answers a single query from the command line.
 *
 * <p>Run with: {@code java -jar place-suggest.jar --q=Londo --latitude=43.0 --longitude=-81.0 --limit=4}
 *
 * <p>Does nothing unless {@code --q} is given. A lone latitude or longitude is
 * validated but ignored, so the results fall back to population order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SuggestionCommandRunner implements ApplicationRunner {

    static final String QUERY = "q";
    static final String LATITUDE = "latitude";
    static final String LONGITUDE = "longitude";
    static final String LIMIT = "limit";

    private final SuggestionService suggestionService;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(QUERY)) {
            return;
        }

        try {
            String query = option(args, QUERY).orElse("");
            SuggestionResponse response = execute(args);
            if (!response.found()) {
                log.info("No suggestions found for '{}'", query);
                return;
            }
            List<Suggestion> suggestions = response.suggestions();
            log.info("{} suggestions for '{}':", suggestions.size(), query);
            for (int i = 0; i < suggestions.size(); i++) {
                Suggestion s = suggestions.get(i);
                log.info("  {}. {} ({}, {}) [{}, {}] score={}", i + 1, s.name(), s.adminRegion(), s.countryCode(),
                    s.latitude(), s.longitude(), s.score());
            }
        } catch (MissingParameterException | InvalidParameterException e) {
            log.warn("Rejected suggestion request: {}", e.getMessage());
        }
    }

    SuggestionResponse execute(ApplicationArguments args) {
        String query = option(args, QUERY)
            .filter(q -> !q.isBlank())
            .orElseThrow(() -> new MissingParameterException(QUERY));

        Optional<Double> latitude = option(args, LATITUDE).map(raw -> parseCoordinate(LATITUDE, raw));
        Optional<Double> longitude = option(args, LONGITUDE).map(raw -> parseCoordinate(LONGITUDE, raw));
        latitude.filter(lat -> !GeoValidator.isValidLatitude(lat))
            .ifPresent(lat -> { throw new InvalidParameterException(LATITUDE, String.valueOf(lat)); });
        longitude.filter(lng -> !GeoValidator.isValidLongitude(lng))
            .ifPresent(lng -> { throw new InvalidParameterException(LONGITUDE, String.valueOf(lng)); });

        Optional<GeoPoint> point = latitude.isPresent() && longitude.isPresent()
            ? Optional.of(new GeoPoint(latitude.get(), longitude.get()))
            : Optional.empty();

        Optional<Integer> limit = option(args, LIMIT).map(this::parseLimit);
        return limit.isPresent()
            ? suggestionService.suggest(query, point, limit.get())
            : suggestionService.suggest(query, point);
    }

    private Optional<String> option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    private double parseCoordinate(String name, String raw) {
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new InvalidParameterException(name, raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(name, raw);
        }
    }

    private int parseLimit(String raw) {
        try {
            int limit = Integer.parseInt(raw.trim());
            if (limit < 0) {
                throw new InvalidParameterException(LIMIT, raw);
            }
            return limit;
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(LIMIT, raw);
        }
    }
}
