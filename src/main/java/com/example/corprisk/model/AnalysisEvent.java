package com.example.corprisk.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * One message of the streaming variant: {@code profile} first, then {@code dimension}
 * events in completion order, then {@code complete}. A lone {@code error} replaces all of
 * them when the company cannot be resolved.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Streaming analysis event")
public record AnalysisEvent(
        @Schema(example = "dimension") String type,
        Object data,
        String message
) {
    public static final String PROFILE = "profile";
    public static final String DIMENSION = "dimension";
    public static final String COMPLETE = "complete";
    public static final String ERROR = "error";

    public static AnalysisEvent profile(CompanyProfile profile) {
        return new AnalysisEvent(PROFILE, profile, null);
    }

    public static AnalysisEvent dimension(DimensionResult result) {
        return new AnalysisEvent(DIMENSION, result, null);
    }

    public static AnalysisEvent complete() {
        return new AnalysisEvent(COMPLETE, null, null);
    }

    public static AnalysisEvent error(String message) {
        return new AnalysisEvent(ERROR, null, message);
    }
}
