package com.example.corprisk.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Static interpretive notes shipped with every result of a dimension.
 */
@Schema(description = "Why a dimension matters and how to read it")
public record Interpretation(
        @Schema(description = "Why this dimension matters") List<String> whyMatters,
        @Schema(description = "Innocent explanations for a non-clean rating") List<String> innocentExplanations,
        @Schema(description = "What the analysis checked") List<String> whatWeChecked
) {
    public Interpretation {
        whyMatters = List.copyOf(whyMatters);
        innocentExplanations = List.copyOf(innocentExplanations);
        whatWeChecked = List.copyOf(whatWeChecked);
    }
}
