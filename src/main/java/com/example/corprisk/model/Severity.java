package com.example.corprisk.model;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

/** Ordered from least to most severe; compare with {@link #atLeast(Severity)}. */
@Schema(description = "Severity of a finding")
public enum Severity {
    NONE("none"), LOW("low"), MEDIUM("medium"), HIGH("high");

    private final String wire;

    Severity(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean atLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
