package io.constela.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import io.constela.core.error.ConstelaError;
import io.constela.core.error.ConstelaErrors;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("Suggestions")
class SuggestionsTest {

    private final Suggestions suggestions = new Suggestions(2);

    @ParameterizedTest
    @CsvSource({"kitten, sitting, 3", "count, count, 0", "cout, count, 1", "'', abc, 3", "abc, '', 3"})
    void levenshteinDistance(String a, String b, int expected) {
        assertThat(Levenshtein.distance(a, b)).isEqualTo(expected);
    }

    @Test
    void picksClosestCandidateWithinThreshold() {
        assertThat(suggestions.closest("incremnt", List.of("reset", "increment", "decrement")))
                .contains("increment");
    }

    @Test
    void nothingBeyondThreshold() {
        assertThat(suggestions.closest("zzz", List.of("count", "items"))).isEmpty();
    }

    @Test
    @DisplayName("Falls back to a candidate that starts with the name")
    void prefixFallback() {
        assertThat(suggestions.closest("incr", List.of("reset", "increment"))).contains("increment");
    }

    @Test
    void decorateAddsHintAndAvailableNames() {
        ConstelaError decorated = suggestions.decorate(
                ConstelaErrors.undefinedState("cout", "/view/value"), "cout", List.of("count", "items"));

        assertThat(decorated.suggestion()).isEqualTo("Did you mean 'count'?");
        assertThat(decorated.context()).containsEntry("availableNames", List.of("count", "items"));
        assertThat(decorated.path()).isEqualTo("/view/value");
    }

    @Test
    void decorateWithoutMatchLeavesSuggestionEmpty() {
        ConstelaError decorated =
                suggestions.decorate(ConstelaErrors.undefinedVar("item", "/view"), "item", List.of());

        assertThat(decorated.suggestion()).isNull();
        assertThat(decorated.context()).containsEntry("availableNames", List.of());
    }
}
