package com.example.corprisk.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "One observed fact feeding a dimension rating")
public class EvidenceItem {

    @Schema(description = "verified | inferred")
    private final Confidence confidence;

    @Schema(description = "none | low | medium | high")
    private final Severity severity;

    @Schema(description = "Stable tag identifying the kind of finding", example = "late_filing")
    private final String type;

    @Schema(description = "Human readable description")
    private final String description;

    @Schema(description = "Structured payload")
    @Builder.Default
    private final Map<String, Object> details = Map.of();

    @Schema(description = "Registry endpoints that contributed", example = "filing-history")
    private final String source;

    @Schema(description = "Reference URL on the public registry site")
    @Builder.Default
    private final String link = "";

    @Schema(description = "Caveat for inferred findings")
    private final String disclaimer;

    public static EvidenceItemBuilder verified(Severity severity, String type) {
        return builder().confidence(Confidence.VERIFIED).severity(severity).type(type);
    }

    public static EvidenceItemBuilder inferred(Severity severity, String type) {
        return builder().confidence(Confidence.INFERRED).severity(severity).type(type);
    }

    /**
     * Ordered detail map from alternating key/value pairs; null values are kept.
     */
    public static Map<String, Object> details(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("details requires key/value pairs");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            out.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(out);
    }

    /** Reads a detail value, or null when absent. */
    public Object detail(String key) {
        return details == null ? null : details.get(key);
    }
}
