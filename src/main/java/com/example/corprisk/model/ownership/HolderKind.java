package com.example.corprisk.model.ownership;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a control-holder from the registry's {@code kind} tag.
 */
public enum HolderKind {
    INDIVIDUAL("individual"),
    CORPORATE("corporate"),
    LEGAL_PERSON("legal-person"),
    OTHER("other");

    private final String wire;

    HolderKind(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static HolderKind fromKind(String kind) {
        if (kind == null) return OTHER;
        // e.g. individual-person-with-significant-control, corporate-entity-beneficial-owner
        if (kind.contains("individual")) return INDIVIDUAL;
        if (kind.contains("corporate")) return CORPORATE;
        if (kind.contains("legal-person")) return LEGAL_PERSON;
        return OTHER;
    }
}
