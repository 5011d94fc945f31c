package com.legalgraph.dto.document;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Value of the {@code primary} store. Holds nothing derived from other
 * documents, so adding a document never rewrites another's record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({
        "id", "corpus_id", "source_url", "display_title", "body",
        "word_count", "paragraph_count", "citation_count", "enrichment"
})
public class PrimaryRecord {

    private String id;

    private String corpusId;

    private String sourceUrl;

    private String displayTitle;

    @Builder.Default
    private List<String> body = new ArrayList<>();

    private int wordCount;

    private int paragraphCount;

    private int citationCount;

    private Enrichment enrichment;
}
