package com.legalgraph.dto.internal;

import com.legalgraph.dto.document.Document;
import com.legalgraph.dto.document.Enrichment;
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
public class ProcessedDocument {

    private Document document;

    @Builder.Default
    private List<ExtractedCitation> citations = new ArrayList<>();

    private Enrichment enrichment;

    public long unresolvedCount() {
        return citations.stream().filter(c -> !c.isResolved()).count();
    }
}
