package com.legalgraph.service.extraction;

import com.legalgraph.config.GraphBuildConfig;
import com.legalgraph.dto.graph.RelationshipKind;
import com.legalgraph.dto.internal.ExtractedCitation;
import com.legalgraph.service.corpus.CorpusAdapter;
import com.legalgraph.service.corpus.CorpusKind;
import com.legalgraph.service.corpus.OhioCorpusAdapters;
import com.legalgraph.util.ContextWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class CitationExtractorTest {

    private CitationExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new CitationExtractor(new GraphBuildConfig(), new ContextWindow());
    }

    @Nested
    @DisplayName("Revised Code")
    class RevisedCode {

        private final CorpusAdapter adapter = OhioCorpusAdapters.revisedCode();

        @Test
        @DisplayName("should yield a single defines edge for 'as defined in section'")
        void shouldPreferDefinesOverGenericSection() {
            String text = "As used in this section, \"property\" has the same meaning "
                    + "as defined in section 2913.01 of the Revised Code.";

            List<ExtractedCitation> citations = extractor.extract(text, adapter);

            assertThat(citations).hasSize(1);
            ExtractedCitation citation = citations.get(0);
            assertThat(citation.getTargetId()).isEqualTo("2913.01");
            assertThat(citation.getRelationship()).isEqualTo(RelationshipKind.DEFINES);
            assertThat(citation.getRawText()).isEqualTo("as defined in section 2913.01");
            assertThat(citation.isResolved()).isTrue();
        }

        @Test
        void shouldGiveOverlappingMatchesToTheFirstListedPattern() {
            List<ExtractedCitation> citations = extractor.extract(
                    "This section is subject to amendment as amended by section 2913.02.", adapter);

            assertThat(citations)
                    .extracting(ExtractedCitation::getTargetId, ExtractedCitation::getRelationship)
                    .containsExactly(tuple("2913.02", RelationshipKind.AMENDS));
        }

        @Test
        @DisplayName("should return citations in ascending offset order")
        void shouldOrderByOffset() {
            String text = "Pursuant to section 2901.05, and subject to R.C. 2901.01, see also 2903.02.";

            List<ExtractedCitation> citations = extractor.extract(text, adapter);

            assertThat(citations)
                    .extracting(ExtractedCitation::getTargetId, ExtractedCitation::getRelationship)
                    .containsExactly(
                            tuple("2901.05", RelationshipKind.CROSS_REFERENCE),
                            tuple("2901.01", RelationshipKind.CITES),
                            tuple("2903.02", RelationshipKind.CITES));
            assertThat(citations).extracting(ExtractedCitation::getByteOffset).isSorted();
        }

        @Test
        @DisplayName("should demote an unnormalizable target to unknown")
        void shouldDemoteToUnknown() {
            List<ExtractedCitation> citations = extractor.extract("See section 12345.6789 for details.", adapter);

            assertThat(citations).hasSize(1);
            assertThat(citations.get(0).getRelationship()).isEqualTo(RelationshipKind.UNKNOWN);
            assertThat(citations.get(0).getTargetId()).isEqualTo("12345.6789");
            assertThat(citations.get(0).isResolved()).isFalse();
        }

        @Test
        @DisplayName("should report offsets in UTF-8 bytes")
        void shouldComputeByteOffsets() {
            String text = "Café résumé section 2913.01";

            List<ExtractedCitation> citations = extractor.extract(text, adapter);

            assertThat(citations).hasSize(1);
            assertThat(citations.get(0).getCharOffset()).isEqualTo(12);
            assertThat(citations.get(0).getByteOffset()).isEqualTo(15L);
        }

        @Test
        void shouldKeepRepeatedCitationsOfTheSameTarget() {
            String text = "See section 2913.01. Also see section 2913.01 again.";

            List<ExtractedCitation> citations = extractor.extract(text, adapter);

            assertThat(citations).extracting(ExtractedCitation::getTargetId)
                    .containsExactly("2913.01", "2913.01");
        }

        @Test
        void shouldBoundContextSnippets() {
            String text = "word ".repeat(100) + "under section 2913.01 " + "word ".repeat(100);

            List<ExtractedCitation> citations = extractor.extract(text, adapter);

            assertThat(citations).hasSize(1);
            assertThat(citations.get(0).getContextSnippet())
                    .hasSizeLessThanOrEqualTo(100)
                    .contains("under section 2913.01");
        }

        @Test
        void shouldNotTreatDollarAmountsAsSections() {
            assertThat(extractor.extract("A fine of not more than $1000.00 may be imposed.", adapter)).isEmpty();
        }
    }

    @Test
    @DisplayName("should resolve constitution citations to canonical ids")
    void shouldExtractConstitutionCitations() {
        String text = "The powers in Article II, Section 1 are limited by Section 2 of Article IV and Art. 4, § 3.";

        List<ExtractedCitation> citations = extractor.extract(text, OhioCorpusAdapters.constitution());

        assertThat(citations).extracting(ExtractedCitation::getTargetId)
                .containsExactly("Article II, Section 1", "Article IV, Section 2", "Article IV, Section 3");
    }

    @Test
    @DisplayName("should refine case citations with a preceding cue")
    void shouldApplyRelationshipCues() {
        String text = "The court overruled State v. Smith, 2010-Ohio-1234. "
                + "In a separate line of authority the court has consistently relied on 123 Ohio St.3d 456.";

        List<ExtractedCitation> citations = extractor.extract(text, OhioCorpusAdapters.caseLaw());

        assertThat(citations)
                .extracting(ExtractedCitation::getTargetId, ExtractedCitation::getRelationship)
                .containsExactly(
                        tuple("2010-Ohio-1234", RelationshipKind.SUPERSEDES),
                        tuple("123 Ohio St.3d 456", RelationshipKind.CITES));
    }

    @Test
    void shouldExtractAdministrativeRules() {
        String text = "Pursuant to rule 3701-17-02, the operator shall comply with section 3721.01 of the Revised Code.";

        List<ExtractedCitation> citations = extractor.extract(text, OhioCorpusAdapters.administrativeCode());

        assertThat(citations)
                .extracting(ExtractedCitation::getTargetId, ExtractedCitation::getRelationship)
                .containsExactly(
                        tuple("3701-17-02", RelationshipKind.CROSS_REFERENCE),
                        tuple("3721.01", RelationshipKind.CROSS_REFERENCE));
    }

    @Test
    @DisplayName("should find nothing with an adapter that has no patterns")
    void shouldHandleZeroPatternAdapter() {
        CorpusAdapter empty = CorpusAdapter.builder().id("plain").kind(CorpusKind.STATUTE).build();

        assertThat(extractor.extract("section 2913.01", empty)).isEmpty();
    }

    @Test
    void shouldHandleEmptyText() {
        assertThat(extractor.extract("", OhioCorpusAdapters.revisedCode())).isEmpty();
    }
}
