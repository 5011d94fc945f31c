package com.legalgraph.service.corpus;

import com.legalgraph.exception.CorpusConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in id normalizers, addressable by name from configuration.
 */
public enum IdNormalizers implements IdNormalizer {

    /**
     * Whitespace-collapsed text as is.
     */
    VERBATIM {
        @Override
        public Optional<String> normalize(String raw) {
            String value = collapse(raw);
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        }
    },

    /**
     * Revised Code sections: {@code 2913.01}.
     */
    SECTION_NUMBER {
        private final Pattern shape = Pattern.compile("^\\d{1,4}\\.\\d{1,4}$");

        @Override
        public Optional<String> normalize(String raw) {
            String value = stripTrailingPunctuation(collapse(raw));
            return shape.matcher(value).matches() ? Optional.of(value) : Optional.empty();
        }
    },

    /**
     * Administrative Code rules: {@code 3701-17-01}, {@code 4901:1-10-01}.
     */
    ADMIN_RULE {
        private final Pattern shape = Pattern.compile("^\\d{3,4}(?::\\d{1,2})?-\\d{1,3}-\\d{1,3}(?:\\.\\d+)?$");

        @Override
        public Optional<String> normalize(String raw) {
            String value = stripTrailingPunctuation(collapse(raw));
            return shape.matcher(value).matches() ? Optional.of(value) : Optional.empty();
        }
    },

    /**
     * Constitution sections, canonical form {@code Article I, Section 1}.
     */
    CONSTITUTION_SECTION {
        private final Pattern articleFirst = Pattern.compile(
                "^(?:ohio\\s+const(?:itution)?\\.?,?\\s+)?art(?:icle|\\.)?\\s*([ivxlcdm]+|\\d+),?\\s*(?:section|sec\\.?|§)\\s*(\\d+[a-z]?)$",
                Pattern.CASE_INSENSITIVE);
        private final Pattern sectionFirst = Pattern.compile(
                "^(\\d+[a-z]?)\\s+of\\s+article\\s+([ivxlcdm]+|\\d+)$",
                Pattern.CASE_INSENSITIVE);

        @Override
        public Optional<String> normalize(String raw) {
            String value = collapse(raw);
            Matcher m = articleFirst.matcher(value);
            if (m.matches()) {
                return canonicalConstitutionId(m.group(1), m.group(2));
            }
            m = sectionFirst.matcher(value);
            if (m.matches()) {
                return canonicalConstitutionId(m.group(2), m.group(1));
            }
            return Optional.empty();
        }
    },

    /**
     * Ohio neutral citations: {@code 2023-Ohio-1234}.
     */
    NEUTRAL_CITATION {
        private final Pattern shape = Pattern.compile("^(\\d{4})-ohio-(\\d+)$", Pattern.CASE_INSENSITIVE);

        @Override
        public Optional<String> normalize(String raw) {
            Matcher m = shape.matcher(collapse(raw));
            if (!m.matches()) {
                return Optional.empty();
            }
            int year = Integer.parseInt(m.group(1));
            if (year < 1990 || year > 2100) {
                return Optional.empty();
            }
            return Optional.of(m.group(1) + "-Ohio-" + m.group(2));
        }
    },

    /**
     * Reporter citations, canonical form {@code 123 Ohio St.3d 456}.
     */
    REPORTER_CITATION {
        private final Pattern shape = Pattern.compile(
                "^(\\d+)\\s+(ohio\\s+st|ohio\\s+app|ohio\\s+misc|n\\.\\s?e|u\\.\\s?s)\\.?\\s*(\\d(?:d|nd|rd|th))?\\s+(\\d+)$",
                Pattern.CASE_INSENSITIVE);

        @Override
        public Optional<String> normalize(String raw) {
            Matcher m = shape.matcher(collapse(raw));
            if (!m.matches()) {
                return Optional.empty();
            }
            String reporterKey = m.group(2).toLowerCase(Locale.ROOT).replaceAll("[\\s.]", "");
            String reporter = REPORTERS.get(reporterKey);
            if (reporter == null) {
                return Optional.empty();
            }
            String series = m.group(3) == null ? "" : normalizeSeries(m.group(3));
            return Optional.of(m.group(1) + " " + reporter + series + " " + m.group(4));
        }
    };

    private static final Map<String, String> REPORTERS = Map.of(
            "ohiost", "Ohio St.",
            "ohioapp", "Ohio App.",
            "ohiomisc", "Ohio Misc.",
            "ne", "N.E.",
            "us", "U.S."
    );

    private static final Map<Character, Integer> ROMAN = Map.of(
            'I', 1, 'V', 5, 'X', 10, 'L', 50, 'C', 100, 'D', 500, 'M', 1000
    );

    private static final int MAX_ARTICLE = 20;

    public static IdNormalizers fromName(String name) {
        return Arrays.stream(values())
                .filter(n -> n.name().equalsIgnoreCase(name.trim().replace('-', '_')))
                .findFirst()
                .orElseThrow(() -> new CorpusConfigurationException("Unknown id normalizer: " + name));
    }

    static String collapse(String raw) {
        return raw == null ? "" : raw.trim().replaceAll("\\s+", " ");
    }

    static String stripTrailingPunctuation(String value) {
        return value.replaceAll("[.,;:]+$", "");
    }

    static Optional<String> canonicalConstitutionId(String article, String section) {
        Integer number = article.chars().allMatch(Character::isDigit)
                ? Integer.valueOf(article)
                : romanValue(article.toUpperCase(Locale.ROOT));
        if (number == null || number < 1 || number > MAX_ARTICLE) {
            return Optional.empty();
        }
        return Optional.of("Article " + toRoman(number) + ", Section " + section.toLowerCase(Locale.ROOT));
    }

    static Integer romanValue(String numeral) {
        int total = 0;
        for (int i = 0; i < numeral.length(); i++) {
            Integer value = ROMAN.get(numeral.charAt(i));
            if (value == null) {
                return null;
            }
            Integer next = i + 1 < numeral.length() ? ROMAN.get(numeral.charAt(i + 1)) : null;
            total += next != null && next > value ? -value : value;
        }
        // rejects non-canonical spellings such as IIII or VX
        return toRoman(total).equals(numeral) ? total : null;
    }

    static String toRoman(int number) {
        int[] values = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
        String[] symbols = {"M", "CM", "D", "CD", "C", "XC", "L", "XL", "X", "IX", "V", "IV", "I"};
        StringBuilder sb = new StringBuilder();
        int remaining = number;
        for (int i = 0; i < values.length; i++) {
            while (remaining >= values[i]) {
                sb.append(symbols[i]);
                remaining -= values[i];
            }
        }
        return sb.toString();
    }

    static String normalizeSeries(String series) {
        String digit = series.substring(0, 1);
        if ("2".equals(digit) || "3".equals(digit)) {
            return digit + "d";
        }
        return digit + "th";
    }
}
