package com.legalgraph.dto.internal;

import com.legalgraph.dto.graph.RelationshipKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedCitation {

    private String targetId;

    private String rawText;

    private RelationshipKind relationship;

    private long byteOffset;

    private int charOffset;

    private String contextSnippet;

    private boolean resolved;
}
