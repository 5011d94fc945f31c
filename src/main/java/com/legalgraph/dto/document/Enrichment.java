package com.legalgraph.dto.document;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based metadata attached to a primary record. Every field may be null
 * (or empty); a missing classification is a valid result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({
        "summary", "document_type", "practice_areas", "complexity",
        "key_terms", "offense_level", "offense_degree"
})
public class Enrichment {

    private String summary;

    private DocumentType documentType;

    @Builder.Default
    private List<String> practiceAreas = new ArrayList<>();

    /**
     * 1 (simple) to 10 (complex).
     */
    private Integer complexity;

    @Builder.Default
    private List<String> keyTerms = new ArrayList<>();

    // criminal documents only
    private String offenseLevel;

    private String offenseDegree;
}
