package com.legalgraph.service.extraction;

import com.legalgraph.config.GraphBuildConfig;
import com.legalgraph.dto.graph.RelationshipKind;
import com.legalgraph.dto.internal.ExtractedCitation;
import com.legalgraph.service.corpus.CitationPattern;
import com.legalgraph.service.corpus.CorpusAdapter;
import com.legalgraph.service.corpus.RelationshipCue;
import com.legalgraph.util.ContextWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;

/**
 * Scans document text with an adapter's patterns and returns every
 * citation occurrence in ascending offset order.
 * <p>
 * Patterns run in adapter order. A match overlapping a span already taken
 * by an earlier pattern is discarded, so specific phrasings listed first
 * shadow the generic patterns that follow. Never throws on input text: a
 * target that cannot be normalized is kept with kind {@code unknown}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CitationExtractor {

    private final GraphBuildConfig config;
    private final ContextWindow contextWindow;

    public List<ExtractedCitation> extract(String text, CorpusAdapter adapter) {
        if (text == null || text.isEmpty() || adapter.getPatterns().isEmpty()) {
            return List.of();
        }

        // accepted spans, start -> end
        TreeMap<Integer, Integer> taken = new TreeMap<>();
        List<ExtractedCitation> citations = new ArrayList<>();

        for (CitationPattern pattern : adapter.getPatterns()) {
            Matcher matcher = pattern.getRegex().matcher(text);
            while (matcher.find()) {
                int start = matcher.start();
                int end = matcher.end();
                if (end == start || overlaps(taken, start, end)) {
                    continue;
                }
                taken.put(start, end);
                citations.add(toCitation(text, matcher, pattern, adapter));
            }
        }

        citations.sort(Comparator.comparingInt(ExtractedCitation::getCharOffset));
        assignByteOffsets(text, citations);
        return citations;
    }

    private ExtractedCitation toCitation(String text, Matcher matcher, CitationPattern pattern, CorpusAdapter adapter) {
        String raw = matcher.group(CitationPattern.TARGET_GROUP);
        Optional<String> normalized = normalize(pattern, raw);

        RelationshipKind relationship;
        String target;
        if (normalized.isPresent()) {
            target = normalized.get();
            relationship = refine(pattern.getRelationship(), text, matcher.start(), adapter);
        } else {
            target = raw == null ? "" : raw.trim();
            relationship = RelationshipKind.UNKNOWN;
            log.debug("Unresolved citation '{}' ({})", matcher.group(), pattern);
        }

        int width = config.getExtraction().getContextWidth();
        return ExtractedCitation.builder()
                .targetId(target)
                .rawText(matcher.group())
                .relationship(relationship)
                .charOffset(matcher.start())
                .contextSnippet(contextWindow.around(text, matcher.start(), matcher.end(), width))
                .resolved(normalized.isPresent())
                .build();
    }

    private Optional<String> normalize(CitationPattern pattern, String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            Optional<String> result = pattern.getNormalizer().normalize(raw);
            return result == null ? Optional.empty() : result;
        } catch (RuntimeException e) {
            log.debug("Normalizer failed on '{}': {}", raw, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Generic {@code cites} matches pick up a stronger relationship from a
     * cue phrase just before the match.
     */
    private RelationshipKind refine(RelationshipKind declared, String text, int matchStart, CorpusAdapter adapter) {
        if (declared != RelationshipKind.CITES || adapter.getCues().isEmpty()) {
            return declared;
        }
        int lookbehind = config.getExtraction().getCueLookbehind();
        CharSequence preceding = text.subSequence(Math.max(0, matchStart - lookbehind), matchStart);
        for (RelationshipCue cue : adapter.getCues()) {
            if (cue.appliesTo(preceding)) {
                return cue.relationship();
            }
        }
        return declared;
    }

    private static boolean overlaps(TreeMap<Integer, Integer> taken, int start, int end) {
        Map.Entry<Integer, Integer> before = taken.floorEntry(start);
        if (before != null && before.getValue() > start) {
            return true;
        }
        Map.Entry<Integer, Integer> after = taken.ceilingEntry(start);
        return after != null && after.getKey() < end;
    }

    /**
     * Converts char offsets to UTF-8 byte offsets in one forward pass.
     */
    private static void assignByteOffsets(String text, List<ExtractedCitation> sorted) {
        int charPos = 0;
        long bytePos = 0;
        for (ExtractedCitation citation : sorted) {
            int target = citation.getCharOffset();
            bytePos += text.substring(charPos, target).getBytes(StandardCharsets.UTF_8).length;
            charPos = target;
            citation.setByteOffset(bytePos);
        }
    }
}
