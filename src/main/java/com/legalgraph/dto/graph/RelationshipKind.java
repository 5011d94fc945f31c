package com.legalgraph.dto.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum RelationshipKind {

    DEFINES("defines"),
    CROSS_REFERENCE("cross_reference"),
    CITES("cites"),
    AMENDS("amends"),
    SUPERSEDES("supersedes"),
    UNKNOWN("unknown");

    private final String label;

    RelationshipKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static RelationshipKind fromLabel(String label) {
        return Arrays.stream(values())
                .filter(kind -> kind.label.equalsIgnoreCase(label) || kind.name().equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown relationship kind: " + label));
    }
}
