package com.ospicorp.soilprofile.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SoilProfile(
    SoilComposition composition,
    ValidatedValue ph,
    @JsonProperty("organic_matter_pct") ValidatedValue organicMatterPct,
    @JsonProperty("nitrogen_pct") ValidatedValue nitrogenPct,
    @JsonProperty("moisture_pct") ValidatedValue moisturePct,
    @JsonProperty("soil_type") SoilType soilType
) {}
