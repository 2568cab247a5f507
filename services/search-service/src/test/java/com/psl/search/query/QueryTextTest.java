package com.psl.search.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class QueryTextTest {

    @Test
    void separatesWordsLiteralsAndWildcards() {
        QueryText text = QueryText.parse("deep \"neural nets\" Transform*");

        assertThat(text.words()).containsExactly("deep");
        assertThat(text.phrases()).containsExactly("neural nets");
        assertThat(text.wildcards()).containsExactly("transform*");
        assertThat(text.stripped()).isEqualTo("deep neural nets Transform*");
    }

    @Test
    void wildcardCharactersInsideLiteralsAreOrdinary() {
        QueryText text = QueryText.parse("\"what is k* anyway?\"");

        assertThat(text.hasWildcards()).isFalse();
        assertThat(text.isLiteral()).isTrue();
        assertThat(text.phrases()).containsExactly("what is k* anyway?");
    }

    @Test
    void leadingWildcardIsRejected() {
        assertThatThrownBy(() -> QueryText.parse("*ology"))
            .isInstanceOf(QueryException.class)
            .hasMessageContaining("wildcard");
        assertThatThrownBy(() -> QueryText.parse("bio ?ology"))
            .isInstanceOf(QueryException.class);
    }

    @Test
    void unterminatedLiteralRunsToTheEnd() {
        QueryText text = QueryText.parse("quantum \"field theory");

        assertThat(text.words()).containsExactly("quantum");
        assertThat(text.phrases()).containsExactly("field theory");
    }

    @Test
    void datePartialMapsTwoDigitYearsAcrossTheCentury() {
        assertThat(QueryText.datePartial("neural 1905 networks")).hasValueSatisfying(partial -> {
            assertThat(partial.month()).isEqualTo("2019-05");
            assertThat(partial.remainder()).isEqualTo("neural networks");
        });
        assertThat(QueryText.datePartial("9912")).hasValueSatisfying(partial -> {
            assertThat(partial.month()).isEqualTo("1999-12");
            assertThat(partial.remainder()).isEmpty();
        });
        assertThat(QueryText.datePartial("1913 flu")).isEmpty();
        assertThat(QueryText.datePartial("12345")).isEmpty();
    }

    @Test
    void authorTermsSplitOnSemicolonAndRewriteClassicForm() {
        assertThat(QueryText.authorTerms("einstein_a; Bohr, N ;; \"de Sitter\""))
            .containsExactly("einstein, a", "Bohr, N", "\"de Sitter\"");
    }
}
