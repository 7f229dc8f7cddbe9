package com.example.corprisk.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
@Schema(description = "Company profile fields echoed in the report")
public class CompanyProfile {
    @Schema(example = "00445790")
    private final String companyNumber;
    private final String companyName;
    @Schema(example = "active")
    private final String companyStatus;
    @Schema(example = "ltd")
    private final String type;
    @Schema(example = "1947-11-27")
    private final String dateOfCreation;
    private final JsonNode registeredOfficeAddress;
    private final List<String> sicCodes;
}
