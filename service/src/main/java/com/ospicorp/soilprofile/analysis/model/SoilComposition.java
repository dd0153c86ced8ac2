package com.ospicorp.soilprofile.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Clay, sand and silt percentages. Once validated the three sum to 100, except for the zero
 * triple which marks a composition that could not be normalized.
 */
public record SoilComposition(double clay, double sand, double silt, boolean valid) {

  public static final SoilComposition EMPTY = new SoilComposition(0d, 0d, 0d, false);

  @JsonIgnore
  public boolean isDegenerate() {
    return clay == 0d && sand == 0d && silt == 0d;
  }
}
