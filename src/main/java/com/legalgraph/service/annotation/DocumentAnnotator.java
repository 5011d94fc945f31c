package com.legalgraph.service.annotation;

import com.legalgraph.dto.document.Document;
import com.legalgraph.dto.document.DocumentType;
import com.legalgraph.dto.document.Enrichment;
import com.legalgraph.service.corpus.CorpusKind;
import com.legalgraph.util.LegalTextTokenizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based enrichment of a single document. Deterministic: the result
 * depends only on the document, its corpus kind and its own citation count.
 */
@Service
@RequiredArgsConstructor
public class DocumentAnnotator {

    private static final List<Pattern> CRIMINAL_INDICATORS = List.of(
            Pattern.compile("felony"), Pattern.compile("misdemeanor"), Pattern.compile("imprisonment"),
            Pattern.compile("imprisoned"), Pattern.compile("convicted"), Pattern.compile("guilty"),
            Pattern.compile("offense"), Pattern.compile("violation"), Pattern.compile("penalty")
    );

    private static final List<String> PROCEDURE_KEYWORDS = List.of(
            "procedure", "process", "filing", "hearing", "motion"
    );

    private static final Map<String, List<String>> PRACTICE_AREA_KEYWORDS = new LinkedHashMap<>();

    static {
        PRACTICE_AREA_KEYWORDS.put("criminal_law", List.of(
                "felony", "misdemeanor", "imprisonment", "convicted", "offense", "guilty", "crime",
                "criminal", "penal", "defendant", "prosecution", "sentence", "jail", "prison", "punish"));
        PRACTICE_AREA_KEYWORDS.put("family_law", List.of(
                "marriage", "divorce", "custody", "child support", "adoption", "spouse", "parent",
                "guardian", "domestic", "alimony", "visitation"));
        PRACTICE_AREA_KEYWORDS.put("property_law", List.of(
                "property", "real estate", "conveyance", "deed", "mortgage", "landlord", "tenant",
                "lease", "title", "easement", "lien"));
        PRACTICE_AREA_KEYWORDS.put("business_law", List.of(
                "corporation", "llc", "partnership", "business", "commercial", "contract",
                "enterprise", "company", "shareholder", "entity"));
        PRACTICE_AREA_KEYWORDS.put("tax_law", List.of(
                "tax", "revenue", "assessment", "levy", "taxation", "taxable", "income tax",
                "sales tax", "property tax"));
        PRACTICE_AREA_KEYWORDS.put("employment_law", List.of(
                "employment", "employee", "employer", "workplace", "labor", "wage", "worker",
                "compensation", "unemployment", "benefits"));
        PRACTICE_AREA_KEYWORDS.put("administrative_law", List.of(
                "agency", "regulation", "administrative", "rule", "board", "commission",
                "department", "licensing", "permit"));
        PRACTICE_AREA_KEYWORDS.put("civil_procedure", List.of(
                "complaint", "summons", "pleading", "discovery", "trial", "judgment", "appeal",
                "motion", "filing"));
    }

    private static final Pattern SECTION_TITLE_NUMBER = Pattern.compile("^(\\d{1,4})\\.\\d+");
    private static final Pattern FELONY_DEGREE =
            Pattern.compile("felony of the (first|second|third|fourth|fifth) degree");
    private static final Pattern MISDEMEANOR_DEGREE =
            Pattern.compile("misdemeanor of the (first|second|third|fourth) degree");
    private static final List<String> ORDINALS = List.of("first", "second", "third", "fourth", "fifth");

    private static final int MAX_KEY_TERMS = 10;

    private final LegalTextTokenizer tokenizer;

    public Enrichment annotate(Document document, CorpusKind kind, int citationCount) {
        String title = document.getDisplayTitle();
        String text = document.searchableText();
        String lower = text.toLowerCase(Locale.ROOT);
        boolean emptyBody = text.isBlank();

        DocumentType type = emptyBody ? null : classify(lower, title, kind);

        Enrichment enrichment = Enrichment.builder()
                .summary(summarize(title))
                .documentType(type)
                .practiceAreas(emptyBody ? new ArrayList<>() : practiceAreas(lower, document.getId()))
                .complexity(emptyBody ? null : complexity(document, citationCount))
                .keyTerms(tokenizer.extractKeyTerms(title, text, MAX_KEY_TERMS))
                .build();

        if (type == DocumentType.CRIMINAL_STATUTE) {
            enrichment.setOffenseLevel(offenseLevel(lower));
            enrichment.setOffenseDegree(offenseDegree(lower));
        }
        return enrichment;
    }

    String summarize(String title) {
        if (title == null || title.isBlank()) {
            return null;
        }
        String subject = title.trim().replaceAll("[.;:,]+$", "").toLowerCase(Locale.ROOT);
        if (subject.isEmpty()) {
            return null;
        }
        if (containsAny(subject, "definition", "definitions", "defined")) {
            return "Defines " + subject;
        }
        if (containsAny(subject, "penalty", "penalties", "punishment")) {
            return "Establishes penalties for " + subject;
        }
        if (containsAny(subject, "procedure", "process", "filing")) {
            return "Describes procedure for " + subject;
        }
        return "Relates to " + subject;
    }

    DocumentType classify(String lowerText, String title, CorpusKind kind) {
        long criminalHits = CRIMINAL_INDICATORS.stream()
                .filter(p -> p.matcher(lowerText).find())
                .count();
        if (criminalHits >= 2) {
            return DocumentType.CRIMINAL_STATUTE;
        }

        String lowerTitle = title == null ? "" : title.toLowerCase(Locale.ROOT);
        if (lowerText.contains("as used in") || lowerTitle.contains("definition")) {
            return DocumentType.DEFINITIONAL;
        }
        if (PROCEDURE_KEYWORDS.stream().anyMatch(lowerText::contains)) {
            return DocumentType.PROCEDURAL;
        }
        return kind.isLegislative() ? DocumentType.CIVIL_STATUTE : DocumentType.OTHER;
    }

    List<String> practiceAreas(String lowerText, String documentId) {
        List<String> areas = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : PRACTICE_AREA_KEYWORDS.entrySet()) {
            long hits = entry.getValue().stream().filter(lowerText::contains).count();
            if (hits >= 2) {
                areas.add(entry.getKey());
            }
        }

        // Revised Code title ranges
        Matcher matcher = documentId == null ? null : SECTION_TITLE_NUMBER.matcher(documentId);
        if (matcher != null && matcher.find()) {
            int titleNumber = Integer.parseInt(matcher.group(1));
            if (titleNumber >= 2900 && titleNumber < 3000) {
                addIfAbsent(areas, "criminal_law");
            }
            if (titleNumber >= 3100 && titleNumber < 3200) {
                addIfAbsent(areas, "family_law");
            }
            if (titleNumber >= 5500 && titleNumber < 5800) {
                addIfAbsent(areas, "tax_law");
            }
            if (titleNumber >= 1700 && titleNumber < 1800) {
                addIfAbsent(areas, "business_law");
            }
        }

        if (areas.isEmpty()) {
            areas.add("general");
        }
        return areas;
    }

    Integer complexity(Document document, int citationCount) {
        int words = document.getWordCount();
        int paragraphs = document.getBody().size();
        int score = 5;

        if (words > 1000) {
            score += 2;
        } else if (words > 500) {
            score += 1;
        } else if (words < 100) {
            score -= 1;
        }

        if (paragraphs > 15) {
            score += 2;
        } else if (paragraphs > 10) {
            score += 1;
        }

        if (citationCount == 0) {
            score -= 1;
        } else {
            double density = words == 0 ? Double.MAX_VALUE : citationCount * 100.0 / words;
            if (density >= 2.0) {
                score += 2;
            } else if (density >= 0.5) {
                score += 1;
            }
        }

        return Math.max(1, Math.min(10, score));
    }

    String offenseLevel(String lowerText) {
        // "minor misdemeanor" contains "misdemeanor", so it is checked first
        if (lowerText.contains("minor misdemeanor")) {
            return "minor_misdemeanor";
        }
        if (lowerText.contains("felony")) {
            return "felony";
        }
        if (lowerText.contains("misdemeanor")) {
            return "misdemeanor";
        }
        return null;
    }

    String offenseDegree(String lowerText) {
        Matcher felony = FELONY_DEGREE.matcher(lowerText);
        if (felony.find()) {
            return "F" + (ORDINALS.indexOf(felony.group(1)) + 1);
        }
        Matcher misdemeanor = MISDEMEANOR_DEGREE.matcher(lowerText);
        if (misdemeanor.find()) {
            return "M" + (ORDINALS.indexOf(misdemeanor.group(1)) + 1);
        }
        return null;
    }

    private static boolean containsAny(String text, String... words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static void addIfAbsent(List<String> areas, String area) {
        if (!areas.contains(area)) {
            areas.add(area);
        }
    }
}
