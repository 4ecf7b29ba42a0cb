package com.nevis.places.runner;

import com.nevis.places.exception.InvalidParameterException;
import com.nevis.places.exception.MissingParameterException;
import com.nevis.places.geo.GeoPoint;
import com.nevis.places.model.Suggestion;
import com.nevis.places.model.SuggestionResponse;
import com.nevis.places.service.SuggestionService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SuggestionCommandRunnerTest {

    @Mock
    private SuggestionService suggestionService;

    @InjectMocks
    private SuggestionCommandRunner runner;

    private static DefaultApplicationArguments args(String... args) {
        return new DefaultApplicationArguments(args);
    }

    @Test
    void shouldDoNothingWithoutQueryOption() {
        runner.run(args("--spring.profiles.active=test"));

        verifyNoInteractions(suggestionService);
    }

    @Test
    void shouldSuggestWithConfiguredLimitWhenNoPointGiven() {
        SuggestionResponse expected = new SuggestionResponse(List.of(
            new Suggestion("London", 51.5, -0.1, 0.83, "GB", "ENG", 8_000_000)));
        when(suggestionService.suggest("Londo", Optional.empty())).thenReturn(expected);

        assertThat(runner.execute(args("--q=Londo"))).isEqualTo(expected);
    }

    @Test
    void shouldUseDistanceModeWhenBothCoordinatesGiven() {
        when(suggestionService.suggest("Londo", Optional.of(new GeoPoint(43.0, -81.0)), 2))
            .thenReturn(SuggestionResponse.empty());

        runner.execute(args("--q=Londo", "--latitude=43.0", "--longitude=-81.0", "--limit=2"));

        verify(suggestionService).suggest("Londo", Optional.of(new GeoPoint(43.0, -81.0)), 2);
    }

    @Test
    void shouldIgnoreLoneCoordinate() {
        when(suggestionService.suggest("Londo", Optional.empty())).thenReturn(SuggestionResponse.empty());

        runner.execute(args("--q=Londo", "--latitude=43.0"));

        verify(suggestionService).suggest("Londo", Optional.empty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"--q=", "--q", "--q=   "})
    void shouldRejectMissingQuery(String query) {
        assertThatThrownBy(() -> runner.execute(args(query)))
            .isInstanceOf(MissingParameterException.class)
            .hasMessage("Parameter 'q' is missing");
    }

    @ParameterizedTest
    @ValueSource(strings = {"--latitude=north", "--latitude=91", "--longitude=east", "--longitude=-180.5", "--limit=-1", "--limit=many"})
    void shouldRejectInvalidParameter(String invalid) {
        assertThatThrownBy(() -> runner.execute(args("--q=Londo", invalid)))
            .isInstanceOf(InvalidParameterException.class);
        verifyNoInteractions(suggestionService);
    }

    @Test
    void shouldNotFailApplicationOnInvalidParameters() {
        assertThatCode(() -> runner.run(args("--q=Londo", "--latitude=north"))).doesNotThrowAnyException();
        assertThatCode(() -> runner.run(args("--q="))).doesNotThrowAnyException();
        verifyNoInteractions(suggestionService);
    }

    @Test
    void shouldReportNotFound() {
        when(suggestionService.suggest(anyString(), any())).thenReturn(SuggestionResponse.empty());

        assertThatCode(() -> runner.run(args("--q=Zzzyzx"))).doesNotThrowAnyException();
        verify(suggestionService).suggest("Zzzyzx", Optional.empty());
    }
}
