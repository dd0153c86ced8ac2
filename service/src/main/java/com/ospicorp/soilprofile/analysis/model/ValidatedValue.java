package com.ospicorp.soilprofile.analysis.model;

/**
 * A scalar after range validation. {@code valid} is false when the reading was absent, not a
 * number, out of range (and clamped) or synthesized from a default.
 */
public record ValidatedValue(double value, boolean valid) {

  public static ValidatedValue synthesized(double value) {
    return new ValidatedValue(value, false);
  }
}
