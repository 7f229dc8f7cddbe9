package com.example.corprisk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Schema(description = "Full risk report for one company")
public class CompanyReport {

    private final CompanyProfile companyProfile;

    @Schema(description = "Dimension id to result; always six entries")
    private final Map<String, DimensionResult> dimensions;

    private final ReportMetadata metadata;

    public CompanyReport(CompanyProfile companyProfile, Map<String, DimensionResult> dimensions, ReportMetadata metadata) {
        this.companyProfile = companyProfile;
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
        this.metadata = metadata;
    }
}
