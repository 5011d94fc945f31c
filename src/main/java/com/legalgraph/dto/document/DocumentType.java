package com.legalgraph.dto.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DocumentType {

    CRIMINAL_STATUTE("criminal_statute"),
    CIVIL_STATUTE("civil_statute"),
    DEFINITIONAL("definitional"),
    PROCEDURAL("procedural"),
    OTHER("other");

    private final String label;

    DocumentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static DocumentType fromLabel(String label) {
        return Arrays.stream(values())
                .filter(type -> type.label.equalsIgnoreCase(label))
                .findFirst()
                .orElse(OTHER);
    }
}
