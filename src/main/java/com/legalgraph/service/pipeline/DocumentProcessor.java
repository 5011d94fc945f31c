package com.legalgraph.service.pipeline;

import com.legalgraph.dto.document.Document;
import com.legalgraph.dto.document.Enrichment;
import com.legalgraph.dto.internal.ExtractedCitation;
import com.legalgraph.dto.internal.ProcessedDocument;
import com.legalgraph.service.annotation.DocumentAnnotator;
import com.legalgraph.service.corpus.CorpusAdapter;
import com.legalgraph.service.extraction.CitationExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Per-document work that can run in parallel: citation extraction followed
 * by annotation. Touches no shared state.
 */
@Component
@RequiredArgsConstructor
public class DocumentProcessor {

    private final CitationExtractor citationExtractor;
    private final DocumentAnnotator documentAnnotator;

    public ProcessedDocument process(Document document, CorpusAdapter adapter) {
        List<ExtractedCitation> citations = citationExtractor.extract(document.searchableText(), adapter);
        Enrichment enrichment = documentAnnotator.annotate(document, adapter.getKind(), citations.size());

        return ProcessedDocument.builder()
                .document(document)
                .citations(citations)
                .enrichment(enrichment)
                .build();
    }
}
