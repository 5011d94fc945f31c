package com.legalgraph.dto.graph;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({
        "corpus_id", "total_documents", "documents_with_outbound", "documents_with_inbound",
        "complex_chains", "total_citations", "unresolved_citations", "citations_by_relationship",
        "skipped_documents",
        "reverse_citation_entries", "dangling_references", "max_outbound_references",
        "most_cited_document", "max_inbound_citations", "average_references_per_document",
        "chain_max_depth", "chain_max_nodes", "build_timestamp", "builder_version", "stores"
})
public class CorpusStats {

    private String corpusId;

    private long totalDocuments;

    private long documentsWithOutbound;

    private long documentsWithInbound;

    private long complexChains;

    private long totalCitations;

    /**
     * Matches whose target did not normalize; stored with kind {@code unknown}.
     */
    private long unresolvedCitations;

    /**
     * Citation count per relationship label, sorted by label.
     */
    @Builder.Default
    private Map<String, Long> citationsByRelationship = new TreeMap<>();

    private long skippedDocuments;

    private long reverseCitationEntries;

    /**
     * Reverse keys with no primary record.
     */
    private long danglingReferences;

    private int maxOutboundReferences;

    private String mostCitedDocument;

    private int maxInboundCitations;

    private double averageReferencesPerDocument;

    private int chainMaxDepth;

    private int chainMaxNodes;

    private String buildTimestamp;

    private String builderVersion;

    @Builder.Default
    private List<String> stores = new ArrayList<>();
}
