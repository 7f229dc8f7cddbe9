package com.example.corprisk.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Output of one analyzer unit")
public class DimensionResult {

    @Schema(description = "Dimension id", example = "filing_discipline")
    private final String dimension;

    @Schema(description = "Display title", example = "Filing Discipline")
    private final String title;

    @Schema(description = "Question this dimension answers")
    private final String question;

    @Schema(description = "clean | investigate | red_flag")
    private final Rating rating;

    @Schema(description = "One line summary")
    private final String summary;

    @Builder.Default
    private final List<EvidenceItem> evidence = List.of();

    @Schema(description = "Explanation of the rule that decided the rating")
    @Builder.Default
    private final String ratingLogic = "";

    @Schema(description = "Suggested follow-up questions")
    @Builder.Default
    private final List<String> whatToAsk = List.of();

    private final Interpretation interpretation;

    @Schema(description = "Dimension level caveat")
    private final String disclaimer;

    @Schema(description = "Failure detail when the analyzer could not complete")
    private final String error;

    public boolean hasEvidence(String type) {
        return evidence.stream().anyMatch(e -> type.equals(e.getType()));
    }

    public List<EvidenceItem> evidenceOfType(String type) {
        return evidence.stream().filter(e -> type.equals(e.getType())).toList();
    }
}
