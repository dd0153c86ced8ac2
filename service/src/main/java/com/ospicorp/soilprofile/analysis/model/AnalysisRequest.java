package com.ospicorp.soilprofile.analysis.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

public record AnalysisRequest(
    @NotNull @Schema(example = "20.5937") Double latitude,
    @NotNull @Schema(example = "78.9629") Double longitude
) {}
