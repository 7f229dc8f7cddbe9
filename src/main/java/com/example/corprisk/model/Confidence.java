package com.example.corprisk.model;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "How a finding was established")
public enum Confidence {
    /** Read directly from registry records. */
    VERIFIED("verified"),
    /** Derived from a timing or similarity correlation that may have an innocent explanation. */
    INFERRED("inferred");

    private final String wire;

    Confidence(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
