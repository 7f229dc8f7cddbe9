package com.example.corprisk.model;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Verdict for one dimension")
public enum Rating {
    CLEAN("clean"), INVESTIGATE("investigate"), RED_FLAG("red_flag");

    private final String wire;

    Rating(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean atLeast(Rating other) {
        return compareTo(other) >= 0;
    }
}
