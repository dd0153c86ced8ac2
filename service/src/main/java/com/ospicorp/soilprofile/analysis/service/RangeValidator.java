package com.ospicorp.soilprofile.analysis.service;

import com.ospicorp.soilprofile.analysis.model.RangeSpec;
import com.ospicorp.soilprofile.analysis.model.SoilComposition;
import com.ospicorp.soilprofile.analysis.model.ValidatedValue;

public final class RangeValidator {
  private static final double FULL_COMPOSITION = 100d;

  private RangeValidator() {
  }

  /**
   * Absent and NaN readings are pinned to the lower bound and flagged invalid. Out-of-range
   * readings are clamped to the nearest bound and flagged invalid.
   */
  public static ValidatedValue validate(Double value, RangeSpec range) {
    if (value == null || value.isNaN()) {
      return new ValidatedValue(range.low(), false);
    }
    if (range.contains(value)) {
      return new ValidatedValue(value, true);
    }
    return new ValidatedValue(value < range.low() ? range.low() : range.high(), false);
  }

  /**
   * Validates each fraction against [0, 100] and rescales the triple to sum to 100. A triple that
   * validates to all zeros cannot be normalized and comes back as {@link SoilComposition#EMPTY}.
   */
  public static SoilComposition validateComposition(Double clay, Double sand, Double silt) {
    ValidatedValue c = validate(clay, RangeSpec.CLAY_PCT);
    ValidatedValue s = validate(sand, RangeSpec.SAND_PCT);
    ValidatedValue t = validate(silt, RangeSpec.SILT_PCT);

    double sum = c.value() + s.value() + t.value();
    if (sum == 0d) {
      return SoilComposition.EMPTY;
    }
    double scale = FULL_COMPOSITION / sum;
    return new SoilComposition(
        c.value() * scale,
        s.value() * scale,
        t.value() * scale,
        c.valid() && s.valid() && t.valid());
  }
}
