package com.legalgraph.service.pipeline;

import com.legalgraph.config.CorpusDatasetConfig;
import com.legalgraph.config.GraphBuildConfig;
import com.legalgraph.dto.document.Document;
import com.legalgraph.dto.document.PrimaryRecord;
import com.legalgraph.dto.graph.BuildCheckpoint;
import com.legalgraph.dto.graph.CorpusStats;
import com.legalgraph.dto.graph.ForwardIndexEntry;
import com.legalgraph.dto.graph.ReverseIndexEntry;
import com.legalgraph.dto.internal.BuildReport;
import com.legalgraph.dto.internal.ChainResult;
import com.legalgraph.dto.internal.ExtractedCitation;
import com.legalgraph.dto.internal.ProcessedDocument;
import com.legalgraph.exception.CitationGraphException;
import com.legalgraph.exception.CorpusConfigurationException;
import com.legalgraph.service.corpus.CorpusAdapter;
import com.legalgraph.service.corpus.CorpusAdapterRegistry;
import com.legalgraph.service.data.DocumentSource;
import com.legalgraph.service.data.DocumentSource.CorpusStream;
import com.legalgraph.service.graph.ChainDetector;
import com.legalgraph.service.graph.GraphAssembler;
import com.legalgraph.service.monitoring.BuildTimer;
import com.legalgraph.service.storage.BuildWorkspace;
import com.legalgraph.service.storage.CitationGraphStore;
import com.legalgraph.service.storage.StorageWriter;
import com.legalgraph.service.storage.StoreName;
import com.legalgraph.util.RecordCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.LongSupplier;
import java.util.stream.Stream;

/**
 * Builds the five stores of a corpus.
 * <p>
 * Documents are streamed in batches; each batch is extracted and annotated
 * on a worker pool, assembled in input order and committed together with a
 * checkpoint. A build interrupted at any point resumes from the last
 * committed batch on the next run. The finished staging directory is then
 * promoted and becomes visible to readers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorpusBuildService {

    private final GraphBuildConfig buildConfig;
    private final CorpusDatasetConfig datasetConfig;
    private final CorpusAdapterRegistry adapterRegistry;
    private final DocumentSource documentSource;
    private final DocumentProcessor documentProcessor;
    private final ChainDetector chainDetector;
    private final StorageWriter storageWriter;
    private final BuildWorkspace workspace;
    private final RecordCodec codec;
    private final Clock clock;

    /**
     * Builds every corpus listed under {@code citation-graph.dataset.corpora}.
     */
    public List<BuildReport> buildAll() {
        List<BuildReport> reports = new ArrayList<>();
        for (CorpusDatasetConfig.CorpusInput corpus : datasetConfig.getCorpora()) {
            reports.add(build(corpus.getId(), Paths.get(corpus.getInput())));
        }
        return reports;
    }

    public BuildReport build(String corpusId) {
        CorpusDatasetConfig.CorpusInput corpus = datasetConfig.findCorpus(corpusId)
                .orElseThrow(() -> new CorpusConfigurationException("No input configured for corpus '" + corpusId + "'"));
        return build(corpusId, Paths.get(corpus.getInput()));
    }

    public BuildReport build(String corpusId, Path input) {
        CorpusAdapter adapter = adapterRegistry.get(corpusId);
        try (CorpusStream stream = documentSource.open(input, adapter)) {
            return run(adapter, stream.documents(), stream::getSkipped);
        }
    }

    /**
     * Builds from an in-memory document stream. Documents must carry ids;
     * corpus id and word count are filled in here.
     */
    public BuildReport build(String corpusId, Stream<Document> documents) {
        CorpusAdapter adapter = adapterRegistry.get(corpusId);
        Stream<Document> normalized = documents.map(d -> d.toBuilder()
                .corpusId(corpusId)
                .wordCount(Document.countWords(d.getBody()))
                .build());
        return run(adapter, normalized, () -> 0L);
    }

    // ============================================================
    // Build
    // ============================================================

    private BuildReport run(CorpusAdapter adapter, Stream<Document> documents, LongSupplier sourceSkipped) {
        String corpusId = adapter.getId();
        BuildTimer timer = new BuildTimer(clock);
        timer.start();

        log.info("\n{}", "=".repeat(70));
        log.info("BUILDING CITATION GRAPH | corpus={}", corpusId);
        log.info("{}\n", "=".repeat(70));

        BuildState state;
        CorpusStats stats;
        CitationGraphStore store = openStaging(corpusId);
        try {
            state = prepare(store, corpusId);
            timer.mark("prepare");

            ingest(adapter, documents, store, state);
            timer.mark("extraction", state.processed);
            log.info("Extraction finished | corpus={} | sources={} | edges_added={} | processed={}",
                    corpusId, state.assembler.sourceCount(), state.assembler.edgeCount(), state.processed);

            SortedMap<String, ReverseIndexEntry> reverse = state.assembler.reverseIndex();
            timer.mark("reverse_index");

            Map<String, List<String>> adjacency = state.assembler.forwardAdjacency();
            List<ChainResult> chains = chainDetector.detect(adjacency);
            timer.mark("chains");

            stats = storageWriter.commitFinal(store, reverse, chains, adjacency,
                    state.checkpoint, sourceSkipped.getAsLong());
            timer.mark("finalize", stats.getTotalDocuments());
        } catch (CitationGraphException e) {
            log.error("Build failed | corpus={} | staging kept for resume | error={}", corpusId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Build failed | corpus={} | staging kept for resume | error={}", corpusId, e.getMessage());
            throw new CitationGraphException("Build of corpus '" + corpusId + "' failed", e);
        } finally {
            store.close();
        }

        String buildId = workspace.newBuildId(corpusId, clock);
        Path buildPath = workspace.promote(corpusId, buildId);
        timer.mark("promote");
        timer.end();

        log.info("\n{}", "=".repeat(70));
        log.info("BUILD COMPLETE | corpus={} | build={}", corpusId, buildId);
        log.info("documents={} | with_outbound={} | with_inbound={} | citations={} | unresolved={} | complex_chains={}",
                stats.getTotalDocuments(), stats.getDocumentsWithOutbound(), stats.getDocumentsWithInbound(),
                stats.getTotalCitations(), stats.getUnresolvedCitations(), stats.getComplexChains());
        log.info("citations_by_relationship={}", stats.getCitationsByRelationship());
        log.info(timer.formatDisplay());
        log.info("{}\n", "=".repeat(70));

        return BuildReport.builder()
                .corpusId(corpusId)
                .buildId(buildId)
                .buildPath(buildPath)
                .resumed(state.resumed)
                .documentsProcessed(state.processed)
                .documentsSkipped(stats.getSkippedDocuments())
                .totalDocuments(stats.getTotalDocuments())
                .complexChains(stats.getComplexChains())
                .totalTime(timer.getTotalTime())
                .stepDurations(timer.getStepDurations())
                .stepDocuments(timer.getStepDocuments())
                .build();
    }

    /**
     * Opens the staging store. A staging build that finished but was never
     * promoted is promoted first; one with neither checkpoint nor result is
     * discarded.
     */
    private CitationGraphStore openStaging(String corpusId) {
        Path staging = workspace.stagingDirectory(corpusId);
        if (CitationGraphStore.exists(staging)) {
            CitationGraphStore existing = CitationGraphStore.open(staging, codec);
            if (existing.loadCheckpoint().isPresent()) {
                return existing;
            }
            boolean finished = existing.contains(StoreName.METADATA, StoreName.CORPUS_INFO_KEY);
            existing.close();
            if (finished) {
                log.info("Found finished but unpromoted build | corpus={}", corpusId);
                workspace.promote(corpusId, workspace.newBuildId(corpusId, clock));
            }
        }
        workspace.wipeStaging(corpusId);
        return CitationGraphStore.open(staging, codec);
    }

    private BuildState prepare(CitationGraphStore store, String corpusId) {
        BuildState state = new BuildState();
        Optional<BuildCheckpoint> saved = store.loadCheckpoint();

        if (saved.isPresent()) {
            state.checkpoint = saved.get();
            state.resumed = true;
            store.forEach(StoreName.CITATIONS, ForwardIndexEntry.class,
                    (id, entry) -> state.assembler.restore(id, entry.getDirectReferences()));
            store.forEachKey(StoreName.PRIMARY, state.seenIds::add);
            log.info("Resuming build | corpus={} | committed={} | batches={} | last_id={}",
                    corpusId, state.checkpoint.getDocumentsCommitted(),
                    state.checkpoint.getBatchesCommitted(), state.checkpoint.getLastCommittedId());
        } else {
            state.checkpoint = BuildCheckpoint.start(corpusId);
            store.saveCheckpoint(state.checkpoint);
        }
        return state;
    }

    private void ingest(CorpusAdapter adapter,
                        Stream<Document> documents,
                        CitationGraphStore store,
                        BuildState state) {
        int batchSize = buildConfig.getBuild().getBatchSize();
        long alreadyConsumed = state.checkpoint.getDocumentsCommitted();
        long position = 0;
        long duplicates = 0;
        List<Document> batch = new ArrayList<>(batchSize);

        try (ExtractionWorkerPool pool = new ExtractionWorkerPool(
                documentProcessor, buildConfig.getBuild().getWorkerThreads(), adapter.getId())) {

            Iterator<Document> iterator = documents.iterator();
            while (iterator.hasNext()) {
                Document document = iterator.next();
                position++;

                if (!state.seenIds.add(document.getId())) {
                    if (position > alreadyConsumed) {
                        duplicates++;
                        log.warn("Skipping duplicate document id | corpus={} | id={}", adapter.getId(), document.getId());
                    }
                    continue;
                }

                batch.add(document);
                if (batch.size() >= batchSize) {
                    commit(adapter, pool, batch, store, state, position, duplicates);
                    duplicates = 0;
                    batch.clear();
                }
            }

            if (!batch.isEmpty() || position > state.checkpoint.getDocumentsCommitted()) {
                commit(adapter, pool, batch, store, state, position, duplicates);
            }
        }
    }

    private void commit(CorpusAdapter adapter,
                        ExtractionWorkerPool pool,
                        List<Document> batch,
                        CitationGraphStore store,
                        BuildState state,
                        long position,
                        long duplicates) {
        List<ProcessedDocument> processed = pool.processAll(batch, adapter);

        List<PrimaryRecord> records = new ArrayList<>(processed.size());
        List<ForwardIndexEntry> forwardEntries = new ArrayList<>();
        List<String> uncited = new ArrayList<>();
        long citations = 0;
        long unresolved = 0;
        BuildCheckpoint previous = state.checkpoint;
        Map<String, Long> byRelationship = new TreeMap<>(previous.getCitationsByRelationship());

        for (ProcessedDocument result : processed) {
            Document document = result.getDocument();
            records.add(toPrimaryRecord(result));
            citations += result.getCitations().size();
            unresolved += result.unresolvedCount();
            for (ExtractedCitation citation : result.getCitations()) {
                byRelationship.merge(citation.getRelationship().getLabel(), 1L, Long::sum);
            }

            Optional<ForwardIndexEntry> forward = state.assembler.accept(document.getId(), result.getCitations());
            if (forward.isPresent()) {
                forwardEntries.add(forward.get());
            } else {
                uncited.add(document.getId());
            }
        }

        state.checkpoint = previous.toBuilder()
                .lastCommittedId(batch.isEmpty() ? previous.getLastCommittedId() : batch.get(batch.size() - 1).getId())
                .documentsCommitted(position)
                .documentsWithOutbound(previous.getDocumentsWithOutbound() + forwardEntries.size())
                .totalCitations(previous.getTotalCitations() + citations)
                .unresolvedCitations(previous.getUnresolvedCitations() + unresolved)
                .citationsByRelationship(byRelationship)
                .skippedDocuments(previous.getSkippedDocuments() + duplicates)
                .batchesCommitted(previous.getBatchesCommitted() + 1)
                .build();

        storageWriter.commitBatch(store, records, forwardEntries, uncited, state.checkpoint);
        state.processed += batch.size();

        log.info("Batch committed | corpus={} | batch={} | docs={} | citations={} | total_docs={}",
                adapter.getId(), state.checkpoint.getBatchesCommitted(), batch.size(), citations, position);
    }

    private PrimaryRecord toPrimaryRecord(ProcessedDocument result) {
        Document document = result.getDocument();
        return PrimaryRecord.builder()
                .id(document.getId())
                .corpusId(document.getCorpusId())
                .sourceUrl(document.getSourceUrl())
                .displayTitle(document.getDisplayTitle())
                .body(new ArrayList<>(document.getBody()))
                .wordCount(document.getWordCount())
                .paragraphCount(document.getBody().size())
                .citationCount(result.getCitations().size())
                .enrichment(result.getEnrichment())
                .build();
    }

    /**
     * Mutable state of one build run.
     */
    private static class BuildState {
        private final GraphAssembler assembler = new GraphAssembler();
        private final Set<String> seenIds = new HashSet<>();
        private BuildCheckpoint checkpoint;
        private boolean resumed;
        private long processed;
    }
}
