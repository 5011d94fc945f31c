package com.legalgraph.dto.graph;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"id", "direct_references", "reference_count", "references_details"})
public class ForwardIndexEntry {

    private String id;

    /**
     * Distinct targets, sorted lexicographically.
     */
    @Builder.Default
    private List<String> directReferences = new ArrayList<>();

    private int referenceCount;

    /**
     * Every edge, ascending by byte offset. Repeated targets are kept.
     */
    @Builder.Default
    private List<CitationEdge> referencesDetails = new ArrayList<>();
}
