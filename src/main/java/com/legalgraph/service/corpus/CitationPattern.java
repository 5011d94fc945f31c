package com.legalgraph.service.corpus;

import com.legalgraph.dto.graph.RelationshipKind;
import com.legalgraph.exception.CorpusConfigurationException;
import lombok.Getter;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled citation pattern. The regex must expose the cited id through
 * a named group called {@code target}.
 */
@Getter
public final class CitationPattern {

    public static final String TARGET_GROUP = "target";

    private final Pattern regex;

    private final RelationshipKind relationship;

    private final IdNormalizer normalizer;

    private CitationPattern(Pattern regex, RelationshipKind relationship, IdNormalizer normalizer) {
        this.regex = regex;
        this.relationship = relationship;
        this.normalizer = normalizer;
    }

    public static CitationPattern of(String regex, RelationshipKind relationship, IdNormalizer normalizer) {
        return compile(regex, relationship, normalizer, true);
    }

    public static CitationPattern compile(String regex,
                                          RelationshipKind relationship,
                                          IdNormalizer normalizer,
                                          boolean caseInsensitive) {
        if (regex == null || regex.isBlank()) {
            throw new CorpusConfigurationException("Citation pattern must not be blank");
        }
        if (!regex.contains("(?<" + TARGET_GROUP + ">")) {
            throw new CorpusConfigurationException(
                    "Citation pattern has no named group '" + TARGET_GROUP + "': " + regex);
        }
        if (relationship == null || relationship == RelationshipKind.UNKNOWN) {
            throw new CorpusConfigurationException(
                    "Citation pattern must declare a relationship other than unknown: " + regex);
        }
        if (normalizer == null) {
            throw new CorpusConfigurationException("Citation pattern has no normalizer: " + regex);
        }
        try {
            int flags = caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0;
            return new CitationPattern(Pattern.compile(regex, flags), relationship, normalizer);
        } catch (PatternSyntaxException e) {
            throw new CorpusConfigurationException("Invalid citation pattern: " + regex, e);
        }
    }

    @Override
    public String toString() {
        return relationship.getLabel() + ":" + regex.pattern();
    }
}
