package com.legalgraph.service.graph;

import com.legalgraph.dto.graph.CitationEdge;
import com.legalgraph.dto.graph.ForwardIndexEntry;
import com.legalgraph.dto.graph.ReverseIndexEntry;
import com.legalgraph.dto.internal.ExtractedCitation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Forward and reverse citation indices of one build.
 * <p>
 * Not thread-safe: a single assembly loop feeds it. Only the id-only
 * adjacency is retained; edge details leave with the returned
 * {@link ForwardIndexEntry}. Self-citations and targets without a document
 * are recorded like any other edge.
 */
@Slf4j
public class GraphAssembler {

    private final Map<String, List<String>> adjacency = new HashMap<>();

    private long edgeCount;

    /**
     * Records the outbound citations of one document.
     *
     * @return the forward entry to persist, or empty when the document cites
     *         nothing
     */
    public Optional<ForwardIndexEntry> accept(String sourceId, List<ExtractedCitation> citations) {
        if (citations == null || citations.isEmpty()) {
            adjacency.remove(sourceId);
            return Optional.empty();
        }

        List<ExtractedCitation> ordered = new ArrayList<>(citations);
        ordered.sort(Comparator.comparingLong(ExtractedCitation::getByteOffset));

        List<CitationEdge> details = new ArrayList<>(ordered.size());
        TreeSet<String> targets = new TreeSet<>();
        for (ExtractedCitation citation : ordered) {
            targets.add(citation.getTargetId());
            details.add(CitationEdge.builder()
                    .target(citation.getTargetId())
                    .relationship(citation.getRelationship())
                    .context(citation.getContextSnippet())
                    .byteOffset(citation.getByteOffset())
                    .matchedText(citation.getRawText())
                    .build());
        }

        List<String> references = List.copyOf(targets);
        adjacency.put(sourceId, references);
        edgeCount += details.size();

        return Optional.of(ForwardIndexEntry.builder()
                .id(sourceId)
                .directReferences(new ArrayList<>(references))
                .referenceCount(references.size())
                .referencesDetails(details)
                .build());
    }

    /**
     * Re-seeds the adjacency from an already committed forward entry.
     */
    public void restore(String sourceId, List<String> directReferences) {
        if (directReferences == null || directReferences.isEmpty()) {
            return;
        }
        adjacency.put(sourceId, List.copyOf(new TreeSet<>(directReferences)));
    }

    /**
     * Inverts the distinct forward targets. Keys are sorted, every
     * {@code cited_by} list is sorted and free of duplicates.
     */
    public SortedMap<String, ReverseIndexEntry> reverseIndex() {
        Map<String, TreeSet<String>> inbound = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : adjacency.entrySet()) {
            for (String target : entry.getValue()) {
                inbound.computeIfAbsent(target, k -> new TreeSet<>()).add(entry.getKey());
            }
        }

        SortedMap<String, ReverseIndexEntry> reverse = new TreeMap<>();
        inbound.forEach((target, sources) -> reverse.put(target, ReverseIndexEntry.builder()
                .id(target)
                .citedBy(new ArrayList<>(sources))
                .citedByCount(sources.size())
                .build()));

        log.debug("Reverse index built | targets={} | sources={}", reverse.size(), adjacency.size());
        return reverse;
    }

    public Map<String, List<String>> forwardAdjacency() {
        return Collections.unmodifiableMap(adjacency);
    }

    public int sourceCount() {
        return adjacency.size();
    }

    /**
     * Edges accepted by this instance, restored entries excluded.
     */
    public long edgeCount() {
        return edgeCount;
    }
}
