package com.legalgraph.service.storage;

import com.legalgraph.dto.document.PrimaryRecord;
import com.legalgraph.dto.graph.Chain;
import com.legalgraph.dto.graph.CorpusStats;
import com.legalgraph.dto.graph.ForwardIndexEntry;
import com.legalgraph.dto.graph.ReverseIndexEntry;
import com.legalgraph.exception.GraphStoreException;
import com.legalgraph.util.RecordCodec;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Read-only view of the build {@code CURRENT} points at. Missing keys are
 * reported as empty results, never as errors.
 */
@Slf4j
public class CitationGraphReader implements AutoCloseable {

    private final CitationGraphStore store;

    private CitationGraphReader(CitationGraphStore store) {
        this.store = store;
    }

    public static CitationGraphReader openCurrent(BuildWorkspace workspace, String corpusId, RecordCodec codec) {
        Path build = workspace.currentBuild(corpusId)
                .orElseThrow(() -> new GraphStoreException("No completed build for corpus '" + corpusId + "'"));
        log.info("Opening citation graph | corpus={} | path={}", corpusId, build);
        return new CitationGraphReader(CitationGraphStore.open(build, codec));
    }

    public Optional<PrimaryRecord> document(String id) {
        return store.get(StoreName.PRIMARY, id, PrimaryRecord.class);
    }

    public Optional<ForwardIndexEntry> citations(String id) {
        return store.get(StoreName.CITATIONS, id, ForwardIndexEntry.class);
    }

    public Optional<ReverseIndexEntry> citedBy(String id) {
        return store.get(StoreName.REVERSE_CITATIONS, id, ReverseIndexEntry.class);
    }

    public Optional<Chain> chain(String id) {
        return store.get(StoreName.CHAINS, id, Chain.class);
    }

    public Optional<CorpusStats> corpusInfo() {
        return store.get(StoreName.METADATA, StoreName.CORPUS_INFO_KEY, CorpusStats.class);
    }

    public Optional<String> raw(StoreName storeName, String key) {
        return store.getRaw(storeName, key);
    }

    public long count(StoreName storeName) {
        return store.count(storeName);
    }

    /**
     * All raw values of one store, sorted by key.
     */
    public SortedMap<String, String> dump(StoreName storeName) {
        return store.snapshot(storeName);
    }

    public Path getBuildPath() {
        return store.getDirectory();
    }

    @Override
    public void close() {
        store.close();
    }
}
