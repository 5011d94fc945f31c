package com.legalgraph.dto.graph;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * Resume state of an unfinished build. Written in the same transaction as
 * the batch it describes and deleted when the build is finalized.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({
        "corpus_id", "last_committed_id", "documents_committed", "documents_with_outbound",
        "total_citations", "unresolved_citations", "citations_by_relationship", "skipped_documents",
        "batches_committed", "updated_at"
})
public class BuildCheckpoint {

    private String corpusId;

    private String lastCommittedId;

    private long documentsCommitted;

    private long documentsWithOutbound;

    private long totalCitations;

    private long unresolvedCitations;

    @Builder.Default
    private Map<String, Long> citationsByRelationship = new TreeMap<>();

    private long skippedDocuments;

    private long batchesCommitted;

    private String updatedAt;

    public static BuildCheckpoint start(String corpusId) {
        return BuildCheckpoint.builder().corpusId(corpusId).build();
    }
}
