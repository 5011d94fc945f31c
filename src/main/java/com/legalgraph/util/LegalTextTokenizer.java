package com.legalgraph.util;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Component
public class LegalTextTokenizer {

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "and", "for", "with", "from", "this", "that", "of", "in",
        "to", "a", "an", "or", "by", "on", "as", "is", "be", "any", "such",
        "shall", "may", "which", "who", "under", "other", "than"
    );

    private static final Pattern TITLE_SEPARATORS = Pattern.compile("[,;.\\-\\s]+");
    private static final Pattern QUOTED = Pattern.compile("[\"“]([^\"“”]+)[\"”]");
    private static final Pattern CAPITALIZED = Pattern.compile("\\b([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*)\\b");

    private static final int MAX_QUOTED_LENGTH = 30;
    private static final int MIN_CAPITALIZED_LENGTH = 6;
    private static final int CAPITALIZED_SCAN_CHARS = 500;

    /**
     * Significant words of a title: longer than three letters, not a stop word.
     */
    public List<String> significantWords(String title) {
        if (title == null || title.isBlank()) {
            return List.of();
        }

        return Arrays.stream(TITLE_SEPARATORS.split(title.toLowerCase(Locale.ROOT)))
            .filter(word -> word.length() > 3)
            .filter(word -> !STOP_WORDS.contains(word))
            .collect(Collectors.toList());
    }

    /**
     * Short quoted phrases, typically defined terms ("motor vehicle").
     */
    public List<String> quotedTerms(String text) {
        List<String> terms = new ArrayList<>();
        if (text == null) {
            return terms;
        }
        Matcher matcher = QUOTED.matcher(text);
        while (matcher.find()) {
            String term = matcher.group(1).trim();
            if (!term.isEmpty() && term.length() < MAX_QUOTED_LENGTH) {
                terms.add(term.toLowerCase(Locale.ROOT));
            }
        }
        return terms;
    }

    /**
     * Capitalized phrases near the start of the text ("Aggravated Murder").
     */
    public List<String> capitalizedPhrases(String text) {
        List<String> phrases = new ArrayList<>();
        if (text == null) {
            return phrases;
        }
        String head = text.length() > CAPITALIZED_SCAN_CHARS ? text.substring(0, CAPITALIZED_SCAN_CHARS) : text;
        Matcher matcher = CAPITALIZED.matcher(head);
        while (matcher.find()) {
            String phrase = matcher.group(1);
            if (phrase.length() >= MIN_CAPITALIZED_LENGTH) {
                phrases.add(phrase.toLowerCase(Locale.ROOT));
            }
        }
        return phrases;
    }

    /**
     * Title words, then quoted terms, then capitalized phrases, de-duplicated
     * in first-seen order.
     */
    public List<String> extractKeyTerms(String title, String text, int maxTerms) {
        Set<String> terms = new LinkedHashSet<>();
        terms.addAll(significantWords(title));
        terms.addAll(quotedTerms(text));
        terms.addAll(capitalizedPhrases(text));

        return terms.stream()
            .limit(maxTerms)
            .collect(Collectors.toList());
    }
}
