package com.legalgraph.service.corpus;

import com.legalgraph.dto.graph.RelationshipKind;

import java.util.List;
import java.util.regex.Pattern;

import static com.legalgraph.dto.graph.RelationshipKind.AMENDS;
import static com.legalgraph.dto.graph.RelationshipKind.CITES;
import static com.legalgraph.dto.graph.RelationshipKind.CROSS_REFERENCE;
import static com.legalgraph.dto.graph.RelationshipKind.DEFINES;
import static com.legalgraph.dto.graph.RelationshipKind.SUPERSEDES;

/**
 * Built-in adapters for the four Ohio corpora.
 * <p>
 * Pattern order matters: when two patterns match overlapping text, the one
 * listed first wins. Specific phrasings (definitions, amendments) therefore
 * precede generic "section N" and bare-number patterns.
 */
public final class OhioCorpusAdapters {

    public static final String REVISED_CODE = "ohio_revised";
    public static final String ADMINISTRATIVE_CODE = "ohio_administrative";
    public static final String CONSTITUTION = "ohio_constitution";
    public static final String CASE_LAW = "ohio_case_law";

    private static final String SECTION = "(?<target>\\d+\\.\\d+)";
    private static final String RULE = "(?<target>\\d[\\d:-]*\\d)";
    private static final String DIVISION = "(?:division\\s*\\([A-Za-z0-9]+\\)\\s+of\\s+)?";
    private static final String PARAGRAPH = "(?:paragraph\\s*\\([A-Za-z0-9]+\\)\\s+of\\s+)?";
    private static final String REFERRAL = "\\b(?:pursuant\\s+to|in\\s+accordance\\s+with|as\\s+provided\\s+in|under)\\s+";
    private static final String REVISED_CODE_PREFIX =
            "\\b(?:R\\.\\s?C\\.|ORC|RC|Ohio\\s+Rev\\.?\\s+Code(?:\\s+Ann\\.)?)\\s*§?\\s*";
    private static final String ARTICLE_SECTION =
            "\\bArt(?:icle|\\.)?\\s*(?:[IVXLCDM]+|\\d+)\\b,?\\s*(?:Section|Sec\\.?|§)\\s*\\d+[a-z]?";
    private static final String SERIES = "(?:\\d(?:d|nd|rd|th))?";

    private OhioCorpusAdapters() {
    }

    public static List<CorpusAdapter> all() {
        return List.of(revisedCode(), administrativeCode(), constitution(), caseLaw());
    }

    public static CorpusAdapter revisedCode() {
        return CorpusAdapter.builder()
                .id(REVISED_CODE)
                .kind(CorpusKind.STATUTE)
                .headerPattern(Pattern.compile("Section\\s+(?<target>\\d+\\.\\d+)", Pattern.CASE_INSENSITIVE))
                .headerNormalizer(IdNormalizers.SECTION_NUMBER)
                .pattern(section("\\b(?:as\\s+defined\\s+in|meaning\\s+(?:of|in)|definition\\s+in)\\s+"
                        + DIVISION + "(?:section|§)\\s*" + SECTION, DEFINES))
                .pattern(section("\\bas\\s+amended\\s+by\\s+(?:section|§)\\s*" + SECTION, AMENDS))
                .pattern(section("\\b(?:superseded|replaced)\\s+by\\s+(?:section|§)\\s*" + SECTION, SUPERSEDES))
                .pattern(section(REFERRAL + DIVISION + "(?:section|§)\\s*" + SECTION, CROSS_REFERENCE))
                .pattern(section("\\bdivision\\s*\\([A-Za-z0-9]+\\)\\s+of\\s+section\\s+" + SECTION, CROSS_REFERENCE))
                .pattern(section(REVISED_CODE_PREFIX + SECTION, CITES))
                .pattern(section("\\bsections?\\s+" + SECTION, CROSS_REFERENCE))
                .pattern(section("(?<![$.\\d])(?<target>\\d{3,4}\\.\\d{1,4})(?!\\d|\\.\\d)", CITES))
                .build();
    }

    public static CorpusAdapter administrativeCode() {
        return CorpusAdapter.builder()
                .id(ADMINISTRATIVE_CODE)
                .kind(CorpusKind.REGULATION)
                .headerPattern(Pattern.compile("Rule\\s+" + RULE, Pattern.CASE_INSENSITIVE))
                .headerNormalizer(IdNormalizers.ADMIN_RULE)
                .pattern(rule("\\bas\\s+defined\\s+in\\s+" + PARAGRAPH + "rule\\s+" + RULE, DEFINES))
                .pattern(rule("\\bas\\s+amended\\s+by\\s+rule\\s+" + RULE, AMENDS))
                .pattern(rule("\\b(?:rescinded|superseded|replaced)\\s+by\\s+rule\\s+" + RULE, SUPERSEDES))
                .pattern(rule(REFERRAL + PARAGRAPH + "rule\\s+" + RULE, CROSS_REFERENCE))
                .pattern(rule("(?:\\bO\\.A\\.C\\.|\\bOAC\\b|\\bOhio\\s+Adm(?:\\.|inistrative)\\s*Code)\\s*" + RULE, CITES))
                .pattern(rule("\\brules?\\s+" + RULE, CROSS_REFERENCE))
                .pattern(rule("(?<![\\d:-])(?<target>\\d{3,4}(?::\\d{1,2})?-\\d{1,3}-\\d{1,3})(?![\\d-])", CITES))
                .pattern(section("\\bsection\\s+" + SECTION + "\\s+of\\s+the\\s+Revised\\s+Code", CROSS_REFERENCE))
                .pattern(section(REVISED_CODE_PREFIX + SECTION, CITES))
                .build();
    }

    public static CorpusAdapter constitution() {
        return CorpusAdapter.builder()
                .id(CONSTITUTION)
                .kind(CorpusKind.CONSTITUTION)
                .headerPattern(Pattern.compile(
                        "(?<target>Article\\s+[IVXLCDM]+,?\\s+Section\\s+\\d+[a-z]?)", Pattern.CASE_INSENSITIVE))
                .headerNormalizer(IdNormalizers.CONSTITUTION_SECTION)
                .pattern(constitutional("(?<target>(?:\\bOhio\\s+Const(?:itution)?\\.?,?\\s+)?" + ARTICLE_SECTION + ")", CITES))
                .pattern(constitutional("\\bsection\\s+(?<target>\\d+[a-z]?\\s+of\\s+Article\\s+(?:[IVXLCDM]+|\\d+))\\b", CITES))
                .pattern(section(REVISED_CODE_PREFIX + SECTION, CITES))
                .pattern(section("\\bsections?\\s+" + SECTION, CROSS_REFERENCE))
                .build();
    }

    public static CorpusAdapter caseLaw() {
        return CorpusAdapter.builder()
                .id(CASE_LAW)
                .kind(CorpusKind.CASE_LAW)
                .headerPattern(Pattern.compile("(?<target>\\d{4}-Ohio-\\d+)", Pattern.CASE_INSENSITIVE))
                .headerNormalizer(IdNormalizers.NEUTRAL_CITATION)
                .pattern(CitationPattern.of("\\b(?<target>\\d{4}-Ohio-\\d+)\\b", CITES, IdNormalizers.NEUTRAL_CITATION))
                .pattern(reporter("\\b(?<target>\\d+\\s+Ohio\\s+(?:St|App|Misc)\\.?\\s*" + SERIES + "\\s+\\d+)\\b"))
                .pattern(reporter("\\b(?<target>\\d+\\s+N\\.\\s?E\\.\\s*" + SERIES + "\\s+\\d+)\\b"))
                .pattern(reporter("\\b(?<target>\\d+\\s+U\\.\\s?S\\.\\s+\\d+)\\b"))
                .pattern(section(REVISED_CODE_PREFIX + SECTION, CITES))
                .pattern(section("\\bsection\\s+" + SECTION + "\\s+of\\s+the\\s+Revised\\s+Code", CITES))
                .pattern(rule("(?:\\bOhio\\s+Adm(?:\\.|inistrative)\\s*Code|\\bOAC\\b)\\s*" + RULE, CITES))
                .pattern(constitutional("(?<target>\\bOhio\\s+Const(?:itution)?\\.?,?\\s+" + ARTICLE_SECTION + ")", CITES))
                .cue(RelationshipCue.of("\\boverrul(?:ed|ing|es)\\b", SUPERSEDES))
                .cue(RelationshipCue.of("\\b(?:superseded|abrogated)\\s+by\\b", SUPERSEDES))
                .cue(RelationshipCue.of("\\b(?:as\\s+amended\\s+by|amending)\\b", AMENDS))
                .build();
    }

    private static CitationPattern section(String regex, RelationshipKind kind) {
        return CitationPattern.of(regex, kind, IdNormalizers.SECTION_NUMBER);
    }

    private static CitationPattern rule(String regex, RelationshipKind kind) {
        return CitationPattern.of(regex, kind, IdNormalizers.ADMIN_RULE);
    }

    private static CitationPattern constitutional(String regex, RelationshipKind kind) {
        return CitationPattern.of(regex, kind, IdNormalizers.CONSTITUTION_SECTION);
    }

    private static CitationPattern reporter(String regex) {
        return CitationPattern.of(regex, CITES, IdNormalizers.REPORTER_CITATION);
    }
}
