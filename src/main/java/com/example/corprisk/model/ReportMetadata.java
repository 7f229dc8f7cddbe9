package com.example.corprisk.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Request metadata")
public record ReportMetadata(
        @Schema(description = "UTC timestamp", example = "2024-05-01T10:15:30Z") String analyzedAt,
        @Schema(description = "Wall clock seconds, one decimal") double elapsedSeconds
) {
}
