package com.ospicorp.soilprofile.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse soil texture class.
 */
public enum SoilType {
  SANDY("Sandy"),
  CLAY("Clay"),
  SILTY("Silty"),
  SANDY_LOAM("Sandy Loam"),
  CLAY_LOAM("Clay Loam"),
  LOAM("Loam"),
  UNKNOWN("Unknown");

  private final String label;

  SoilType(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}
