package com.legalgraph.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LegalTextTokenizerTest {

    private final LegalTextTokenizer tokenizer = new LegalTextTokenizer();

    @Test
    void shouldDropStopWordsAndShortTitleWords() {
        assertThat(tokenizer.significantWords("The owner of the property shall consent"))
                .containsExactly("owner", "property", "consent");
    }

    @Test
    void shouldCollectTitleWordsQuotedTermsAndCapitalizedPhrases() {
        String text = "As used in this section, \"motor vehicle\" includes any Aggravated Vehicular Assault.";

        List<String> terms = tokenizer.extractKeyTerms("Unauthorized use of a vehicle.", text, 10);

        assertThat(terms).containsExactly(
                "unauthorized", "vehicle", "motor vehicle", "aggravated vehicular assault");
    }

    @Test
    void shouldLimitKeyTerms() {
        String text = "\"alpha\" \"bravo\" \"charlie\" \"delta\" \"echo\" \"foxtrot\"";

        List<String> terms = tokenizer.extractKeyTerms("General Provisions Regarding Many Things Here", text, 10);

        assertThat(terms).hasSize(10);
        assertThat(terms).startsWith("general", "provisions", "regarding", "many");
    }

    @Test
    void shouldSkipLongQuotedPassages() {
        String text = "\"this quoted passage is far too long to be a defined term\"";

        assertThat(tokenizer.quotedTerms(text)).isEmpty();
    }
}
