package com.legalgraph.service.corpus;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-corpus configuration: citation patterns in priority order plus the
 * id format of the corpus. Adapters are immutable once built.
 */
@Getter
@Builder
public class CorpusAdapter {

    private final String id;

    private final CorpusKind kind;

    /**
     * Locates the document id inside a raw header such as
     * {@code "Section 2913.02|Theft."}. Optional.
     */
    private final Pattern headerPattern;

    private final IdNormalizer headerNormalizer;

    @Singular
    private final List<CitationPattern> patterns;

    @Singular
    private final List<RelationshipCue> cues;

    /**
     * Derives a document id from a header line when the input record has
     * no explicit id.
     */
    public Optional<String> resolveDocumentId(String header) {
        if (header == null || header.isBlank() || headerPattern == null) {
            return Optional.empty();
        }
        Matcher matcher = headerPattern.matcher(header);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String raw = matcher.group(CitationPattern.TARGET_GROUP);
        IdNormalizer normalizer = headerNormalizer != null ? headerNormalizer : IdNormalizers.VERBATIM;
        return normalizer.normalize(raw);
    }

    @Override
    public String toString() {
        return "CorpusAdapter[" + id + ", " + kind + ", " + patterns.size() + " patterns]";
    }
}
