package com.legalgraph.dto.graph;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One citation occurrence inside a source document. The source id is the
 * key of the enclosing {@link ForwardIndexEntry}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"target", "relationship", "context", "byte_offset", "matched_text"})
public class CitationEdge {

    private String target;

    private RelationshipKind relationship;

    private String context;

    private long byteOffset;

    private String matchedText;
}
