package com.ospicorp.soilprofile.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Confidence in a profile. Declaration order is the ranking, lowest first.
 */
public enum DataQuality {
  INSUFFICIENT("Insufficient"),
  LOW("Low"),
  MEDIUM("Medium"),
  HIGH("High");

  private final String label;

  DataQuality(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public boolean isAtLeast(DataQuality other) {
    return compareTo(other) >= 0;
  }
}
