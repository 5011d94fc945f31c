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
@JsonPropertyOrder({"id", "chain_sections", "chain_depth", "section_count", "complete_chain"})
public class Chain {

    private String id;

    /**
     * BFS discovery order, root first.
     */
    @Builder.Default
    private List<String> chainSections = new ArrayList<>();

    /**
     * Hops from the root to the deepest discovered section.
     */
    private int chainDepth;

    private int sectionCount;

    @Builder.Default
    private List<ChainMember> completeChain = new ArrayList<>();
}
