package com.ospicorp.soilprofile.analysis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Physically plausible interval for a named scalar. Bounds are inclusive.
 */
public record RangeSpec(String name, double low, double high, String unit) {

  public static final RangeSpec TEMPERATURE_C = new RangeSpec("temperature", -50d, 60d, "°C");
  public static final RangeSpec HUMIDITY_PCT = new RangeSpec("humidity", 0d, 100d, "%");
  public static final RangeSpec PRECIPITATION_MM = new RangeSpec("precipitation", 0d, 100d, "mm");
  public static final RangeSpec CLAY_PCT = new RangeSpec("clay", 0d, 100d, "%");
  public static final RangeSpec SAND_PCT = new RangeSpec("sand", 0d, 100d, "%");
  public static final RangeSpec SILT_PCT = new RangeSpec("silt", 0d, 100d, "%");
  public static final RangeSpec PH = new RangeSpec("ph", 3d, 10d, "pH");
  public static final RangeSpec ORGANIC_MATTER_PCT = new RangeSpec("organic_matter", 0d, 30d, "%");
  public static final RangeSpec NITROGEN_PCT = new RangeSpec("nitrogen", 0d, 5d, "%");
  public static final RangeSpec MOISTURE_PCT = new RangeSpec("moisture", 0d, 100d, "%");

  /** All known ranges keyed by name, in declaration order. */
  public static final Map<String, RangeSpec> TABLE = table(TEMPERATURE_C, HUMIDITY_PCT,
      PRECIPITATION_MM, CLAY_PCT, SAND_PCT, SILT_PCT, PH, ORGANIC_MATTER_PCT, NITROGEN_PCT,
      MOISTURE_PCT);

  public RangeSpec {
    if (!(low <= high)) {
      throw new IllegalArgumentException("low must not exceed high for range " + name);
    }
  }

  public boolean contains(double value) {
    return value >= low && value <= high;
  }

  private static Map<String, RangeSpec> table(RangeSpec... specs) {
    Map<String, RangeSpec> byName = new LinkedHashMap<>();
    for (RangeSpec spec : specs) {
      byName.put(spec.name(), spec);
    }
    return Collections.unmodifiableMap(byName);
  }
}
