package com.legalgraph.service.corpus;

import com.legalgraph.dto.graph.RelationshipKind;

import java.util.regex.Pattern;

/**
 * Phrase preceding a generic citation that refines its relationship,
 * e.g. "overruled by" turns a plain cite into a supersession.
 */
public record RelationshipCue(Pattern phrase, RelationshipKind relationship) {

    public static RelationshipCue of(String regex, RelationshipKind relationship) {
        return new RelationshipCue(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), relationship);
    }

    public boolean appliesTo(CharSequence precedingText) {
        return phrase.matcher(precedingText).find();
    }
}
