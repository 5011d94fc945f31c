package com.legalgraph.service.storage;

import com.legalgraph.config.GraphBuildConfig;
import com.legalgraph.dto.document.PrimaryRecord;
import com.legalgraph.dto.graph.BuildCheckpoint;
import com.legalgraph.dto.graph.Chain;
import com.legalgraph.dto.graph.ChainMember;
import com.legalgraph.dto.graph.CorpusStats;
import com.legalgraph.dto.graph.ForwardIndexEntry;
import com.legalgraph.dto.graph.ReverseIndexEntry;
import com.legalgraph.dto.internal.ChainResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Writes build output into the five stores.
 * <p>
 * Absence is meaningful: a document with no outbound citations has no
 * {@code citations} key, an uncited id has no {@code reverse_citations} key
 * and only complex chains get a {@code chains} key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StorageWriter {

    private final GraphBuildConfig config;
    private final Clock clock;

    /**
     * Commits one batch of primary records and forward entries together
     * with the checkpoint that covers them.
     *
     * @param uncited ids of batch documents without outbound citations
     */
    public void commitBatch(CitationGraphStore store,
                            List<PrimaryRecord> records,
                            List<ForwardIndexEntry> forwardEntries,
                            List<String> uncited,
                            BuildCheckpoint checkpoint) {
        Map<String, PrimaryRecord> primary = new LinkedHashMap<>();
        records.forEach(r -> primary.put(r.getId(), r));
        Map<String, ForwardIndexEntry> citations = new LinkedHashMap<>();
        forwardEntries.forEach(e -> citations.put(e.getId(), e));

        BuildCheckpoint stamped = checkpoint.toBuilder()
                .updatedAt(Instant.now(clock).toString())
                .build();

        store.inTransaction(() -> {
            store.putAll(StoreName.PRIMARY, primary);
            store.putAll(StoreName.CITATIONS, citations);
            store.deleteAll(StoreName.CITATIONS, uncited);
            store.saveCheckpoint(stamped);
        });

        log.debug("Committed batch | docs={} | with_citations={} | total_committed={}",
                records.size(), forwardEntries.size(), checkpoint.getDocumentsCommitted());
    }

    /**
     * Writes reverse index, complex chains and corpus statistics, and drops
     * the checkpoint, in one transaction.
     */
    public CorpusStats commitFinal(CitationGraphStore store,
                                   SortedMap<String, ReverseIndexEntry> reverseIndex,
                                   List<ChainResult> complexChains,
                                   Map<String, List<String>> adjacency,
                                   BuildCheckpoint checkpoint,
                                   long sourceSkipped) {
        AtomicReference<CorpusStats> stats = new AtomicReference<>();

        store.inTransaction(() -> {
            store.clear(StoreName.REVERSE_CITATIONS);
            store.putAll(StoreName.REVERSE_CITATIONS, reverseIndex);

            store.clear(StoreName.CHAINS);
            Map<String, Chain> chains = new LinkedHashMap<>();
            for (ChainResult result : complexChains) {
                chains.put(result.rootId(), materializeChain(store, result));
            }
            store.putAll(StoreName.CHAINS, chains);

            stats.set(computeStats(store, reverseIndex, complexChains.size(), adjacency, checkpoint, sourceSkipped));
            store.put(StoreName.METADATA, StoreName.CORPUS_INFO_KEY, stats.get());
            store.deleteCheckpoint();
        });

        log.info("Final stores written | reverse_entries={} | chains={}", reverseIndex.size(), complexChains.size());
        return stats.get();
    }

    /**
     * Expands a chain with the primary record of each member. Members
     * without a record (dangling references) carry only their id.
     */
    public Chain materializeChain(CitationGraphStore store, ChainResult result) {
        List<ChainMember> members = new ArrayList<>(result.size());
        for (String id : result.sections()) {
            Optional<PrimaryRecord> record = store.get(StoreName.PRIMARY, id, PrimaryRecord.class);
            members.add(record
                    .map(r -> ChainMember.builder()
                            .id(id)
                            .displayTitle(r.getDisplayTitle())
                            .sourceUrl(r.getSourceUrl())
                            .body(r.getBody())
                            .wordCount(r.getWordCount())
                            .build())
                    .orElseGet(() -> ChainMember.builder().id(id).build()));
        }

        return Chain.builder()
                .id(result.rootId())
                .chainSections(new ArrayList<>(result.sections()))
                .chainDepth(result.depth())
                .sectionCount(result.size())
                .completeChain(members)
                .build();
    }

    CorpusStats computeStats(CitationGraphStore store,
                             SortedMap<String, ReverseIndexEntry> reverseIndex,
                             long complexChains,
                             Map<String, List<String>> adjacency,
                             BuildCheckpoint checkpoint,
                             long sourceSkipped) {
        long totalDocuments = store.count(StoreName.PRIMARY);
        long withInbound = store.countSharedKeys(StoreName.REVERSE_CITATIONS, StoreName.PRIMARY);

        String mostCited = null;
        int maxInbound = 0;
        // sorted iteration keeps the lexicographically smallest id on ties
        for (ReverseIndexEntry entry : reverseIndex.values()) {
            if (entry.getCitedByCount() > maxInbound) {
                maxInbound = entry.getCitedByCount();
                mostCited = entry.getId();
            }
        }

        int maxOutbound = 0;
        long distinctReferences = 0;
        for (List<String> references : adjacency.values()) {
            maxOutbound = Math.max(maxOutbound, references.size());
            distinctReferences += references.size();
        }

        double average = totalDocuments == 0 ? 0.0 : BigDecimal.valueOf(distinctReferences)
                .divide(BigDecimal.valueOf(totalDocuments), 2, RoundingMode.HALF_UP)
                .doubleValue();

        return CorpusStats.builder()
                .corpusId(checkpoint.getCorpusId())
                .totalDocuments(totalDocuments)
                .documentsWithOutbound(store.count(StoreName.CITATIONS))
                .documentsWithInbound(withInbound)
                .complexChains(complexChains)
                .totalCitations(checkpoint.getTotalCitations())
                .unresolvedCitations(checkpoint.getUnresolvedCitations())
                .citationsByRelationship(new TreeMap<>(checkpoint.getCitationsByRelationship()))
                .skippedDocuments(checkpoint.getSkippedDocuments() + sourceSkipped)
                .reverseCitationEntries(reverseIndex.size())
                .danglingReferences(reverseIndex.size() - withInbound)
                .maxOutboundReferences(maxOutbound)
                .mostCitedDocument(mostCited)
                .maxInboundCitations(maxInbound)
                .averageReferencesPerDocument(average)
                .chainMaxDepth(config.getChain().getMaxDepth())
                .chainMaxNodes(config.getChain().getMaxNodes())
                .buildTimestamp(Instant.now(clock).toString())
                .builderVersion(config.getBuilderVersion())
                .stores(StoreName.names())
                .build();
    }
}
