package com.legalgraph.service.corpus;

import com.legalgraph.exception.CorpusConfigurationException;

import java.util.Arrays;

public enum CorpusKind {

    STATUTE,
    REGULATION,
    CONSTITUTION,
    CASE_LAW;

    /**
     * Statutes and regulations default to {@code civil_statute} when no
     * narrower type applies.
     */
    public boolean isLegislative() {
        return this == STATUTE || this == REGULATION;
    }

    public static CorpusKind fromLabel(String label) {
        if (label == null) {
            throw new CorpusConfigurationException("Corpus kind must not be null");
        }
        return Arrays.stream(values())
                .filter(kind -> kind.name().equalsIgnoreCase(label.replace('-', '_')))
                .findFirst()
                .orElseThrow(() -> new CorpusConfigurationException("Unknown corpus kind: " + label));
    }
}
