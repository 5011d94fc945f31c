package com.legalgraph.dto.graph;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Materialized copy of one document in a chain. Dangling targets have only
 * the id set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"id", "display_title", "source_url", "body", "word_count"})
public class ChainMember {

    private String id;

    private String displayTitle;

    private String sourceUrl;

    private List<String> body;

    private Integer wordCount;
}
