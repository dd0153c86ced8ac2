package com.ospicorp.soilprofile.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record EnvironmentalConditions(
    @JsonProperty("temperature_c") ValidatedValue temperatureC,
    @JsonProperty("humidity_pct") ValidatedValue humidityPct,
    @JsonProperty("precipitation_mm") ValidatedValue precipitationMm
) {

  @JsonIgnore
  public boolean isAllValid() {
    return temperatureC.valid() && humidityPct.valid() && precipitationMm.valid();
  }
}
