package com.example.corprisk.model.ownership;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "One control-holding entity in an ownership trace")
public class OwnershipNode {

    private final String name;

    private final HolderKind kind;

    @Schema(description = "Registry natures-of-control tags, e.g. ownership-of-shares-75-to-100-percent")
    @Builder.Default
    private final List<String> naturesOfControl = List.of();

    @Schema(description = "Depth of the controlled company in the trace, target = 0")
    private final int depth;

    @Schema(description = "Company this holder controls")
    private final String companyNumber;

    private final String registrationNumber;

    private final String jurisdiction;

    private final String nationality;

    @Schema(description = "True when the trace stops at this node")
    private final boolean terminal;

    private final boolean foreign;

    private final boolean trust;

    @Schema(description = "Corporate holder already visited or beyond the depth bound")
    private final boolean untraceable;

    @Builder.Default
    private final List<OwnershipNode> subLayers = List.of();
}
