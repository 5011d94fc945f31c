package com.legalgraph.service.pipeline;

import com.legalgraph.dto.document.Document;
import com.legalgraph.dto.internal.ProcessedDocument;
import com.legalgraph.exception.CitationGraphException;
import com.legalgraph.service.corpus.CorpusAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool running {@link DocumentProcessor} over a batch. Results come
 * back in input order so the assembly loop stays deterministic.
 */
@Slf4j
public class ExtractionWorkerPool implements AutoCloseable {

    private final ExecutorService executor;
    private final DocumentProcessor processor;

    public ExtractionWorkerPool(DocumentProcessor processor, int threads, String corpusId) {
        AtomicInteger counter = new AtomicInteger();
        this.processor = processor;
        this.executor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "extract-" + corpusId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.debug("Started extraction pool | corpus={} | threads={}", corpusId, threads);
    }

    public List<ProcessedDocument> processAll(List<Document> batch, CorpusAdapter adapter) {
        List<Callable<ProcessedDocument>> tasks = new ArrayList<>(batch.size());
        for (Document document : batch) {
            tasks.add(() -> processor.process(document, adapter));
        }

        try {
            List<Future<ProcessedDocument>> futures = executor.invokeAll(tasks);
            List<ProcessedDocument> results = new ArrayList<>(futures.size());
            for (Future<ProcessedDocument> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CitationGraphException("Interrupted while processing batch", e);
        } catch (ExecutionException e) {
            throw new CitationGraphException("Document processing failed", e.getCause());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
