package com.example.corprisk.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Analysis request")
public record AnalyzeRequest(
        @JsonProperty("company_number")
        @Schema(description = "Registry number; all-digit input is zero-padded to 8", example = "445790")
        String companyNumber
) {
}
