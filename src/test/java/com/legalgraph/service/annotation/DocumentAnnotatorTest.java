package com.legalgraph.service.annotation;

import com.legalgraph.dto.document.Document;
import com.legalgraph.dto.document.DocumentType;
import com.legalgraph.dto.document.Enrichment;
import com.legalgraph.service.corpus.CorpusKind;
import com.legalgraph.util.LegalTextTokenizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentAnnotatorTest {

    private final DocumentAnnotator annotator = new DocumentAnnotator(new LegalTextTokenizer());

    @Nested
    @DisplayName("criminal statutes")
    class CriminalStatutes {

        @Test
        @DisplayName("should classify theft as a fifth degree felony")
        void shouldAnnotateTheft() {
            Document theft = document("2913.02", "Theft.",
                    "No person, with purpose to deprive the owner of property or services, shall knowingly "
                            + "obtain or exert control over either the property or services in any of the following ways:",
                    "(A) Without the consent of the owner or person authorized to give consent;",
                    "Whoever violates this section is guilty of theft, a felony of the fifth degree.");

            Enrichment enrichment = annotator.annotate(theft, CorpusKind.STATUTE, 0);

            assertThat(enrichment.getSummary()).isEqualTo("Relates to theft");
            assertThat(enrichment.getDocumentType()).isEqualTo(DocumentType.CRIMINAL_STATUTE);
            assertThat(enrichment.getOffenseLevel()).isEqualTo("felony");
            assertThat(enrichment.getOffenseDegree()).isEqualTo("F5");
            assertThat(enrichment.getPracticeAreas()).containsExactly("criminal_law");
            assertThat(enrichment.getComplexity()).isEqualTo(3);
            assertThat(enrichment.getKeyTerms()).startsWith("theft");
        }

        @Test
        @DisplayName("should recognise a minor misdemeanor before a plain misdemeanor")
        void shouldPreferMinorMisdemeanor() {
            Document doc = document("4511.99", "Penalties.",
                    "Whoever violates this section is guilty of a minor misdemeanor.");

            Enrichment enrichment = annotator.annotate(doc, CorpusKind.STATUTE, 0);

            assertThat(enrichment.getSummary()).isEqualTo("Establishes penalties for penalties");
            assertThat(enrichment.getOffenseLevel()).isEqualTo("minor_misdemeanor");
            assertThat(enrichment.getOffenseDegree()).isNull();
        }

        @Test
        void shouldExtractMisdemeanorDegree() {
            Document doc = document("2917.11", "Disorderly conduct.",
                    "Whoever violates this section is guilty of a misdemeanor of the first degree.");

            Enrichment enrichment = annotator.annotate(doc, CorpusKind.STATUTE, 0);

            assertThat(enrichment.getOffenseLevel()).isEqualTo("misdemeanor");
            assertThat(enrichment.getOffenseDegree()).isEqualTo("M1");
        }
    }

    @Nested
    @DisplayName("document types")
    class DocumentTypes {

        @Test
        void shouldClassifyDefinitions() {
            Document doc = document("1.02", "Definitions in Revised Code.",
                    "As used in the Revised Code, unless the context otherwise requires:",
                    "(A) \"Whoever\" includes all persons, natural and artificial.");

            Enrichment enrichment = annotator.annotate(doc, CorpusKind.STATUTE, 0);

            assertThat(enrichment.getDocumentType()).isEqualTo(DocumentType.DEFINITIONAL);
            assertThat(enrichment.getSummary()).isEqualTo("Defines definitions in revised code");
            assertThat(enrichment.getOffenseLevel()).isNull();
            assertThat(enrichment.getKeyTerms()).contains("definitions", "revised", "code", "whoever");
        }

        @Test
        void shouldClassifyProcedure() {
            Document doc = document("2505.04", null,
                    "The clerk shall schedule a hearing on the motion within ten days.");

            assertThat(annotator.annotate(doc, CorpusKind.STATUTE, 0).getDocumentType())
                    .isEqualTo(DocumentType.PROCEDURAL);
        }

        @Test
        void shouldFallBackByCorpusKind() {
            Document doc = document("4740.06", null, "The board may issue a license to any applicant.");

            assertThat(annotator.annotate(doc, CorpusKind.REGULATION, 0).getDocumentType())
                    .isEqualTo(DocumentType.CIVIL_STATUTE);
            assertThat(annotator.annotate(doc, CorpusKind.CASE_LAW, 0).getDocumentType())
                    .isEqualTo(DocumentType.OTHER);
        }
    }

    @Nested
    @DisplayName("complexity")
    class Complexity {

        @Test
        void shouldRewardCitationDensity() {
            Document doc = document("3.01", null, "word ".repeat(50).trim());

            assertThat(annotator.annotate(doc, CorpusKind.STATUTE, 2).getComplexity()).isEqualTo(6);
        }

        @Test
        void shouldScoreLongMultiParagraphDocuments() {
            List<String> paragraphs = new ArrayList<>(Collections.nCopies(16, "word ".repeat(75).trim()));
            Document doc = document("3.02", null, paragraphs.toArray(new String[0]));

            assertThat(annotator.annotate(doc, CorpusKind.STATUTE, 0).getComplexity()).isEqualTo(8);
        }

        @Test
        void shouldClampToOne() {
            Document doc = document("3.03", null, "Short text.");

            assertThat(annotator.annotate(doc, CorpusKind.STATUTE, 0).getComplexity()).isEqualTo(3);
            assertThat(annotator.complexity(doc, 0)).isBetween(1, 10);
        }
    }

    @Test
    @DisplayName("should leave body-derived fields empty for an empty body")
    void shouldHandleEmptyBody() {
        Document doc = document("1.99", "Reserved.");

        Enrichment enrichment = annotator.annotate(doc, CorpusKind.STATUTE, 0);

        assertThat(enrichment.getSummary()).isEqualTo("Relates to reserved");
        assertThat(enrichment.getDocumentType()).isNull();
        assertThat(enrichment.getComplexity()).isNull();
        assertThat(enrichment.getPracticeAreas()).isEmpty();
    }

    @Test
    void shouldOmitSummaryWithoutTitle() {
        Document doc = document("5.01", null, "Any text at all.");

        assertThat(annotator.annotate(doc, CorpusKind.STATUTE, 0).getSummary()).isNull();
    }

    @Test
    void shouldAddPracticeAreasFromTitleRanges() {
        Document doc = document("5747.02", null, "The rate shall be computed as follows.");

        assertThat(annotator.annotate(doc, CorpusKind.STATUTE, 0).getPracticeAreas()).containsExactly("tax_law");
    }

    @Test
    void shouldBeDeterministic() {
        Document doc = document("2913.02", "Theft.", "Whoever commits theft is guilty of a felony.");

        assertThat(annotator.annotate(doc, CorpusKind.STATUTE, 1))
                .isEqualTo(annotator.annotate(doc, CorpusKind.STATUTE, 1));
    }

    private static Document document(String id, String title, String... paragraphs) {
        List<String> body = List.of(paragraphs);
        return Document.builder()
                .id(id)
                .corpusId("ohio_revised")
                .displayTitle(title)
                .body(body)
                .wordCount(Document.countWords(body))
                .build();
    }
}
