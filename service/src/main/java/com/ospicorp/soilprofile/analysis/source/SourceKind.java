package com.ospicorp.soilprofile.analysis.source;

/**
 * The three external providers, in the order their statuses are reported.
 */
public enum SourceKind {
  WEATHER("weather"),
  ATMOSPHERIC("atmospheric"),
  SOIL("soil");

  private final String id;

  SourceKind(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }
}
