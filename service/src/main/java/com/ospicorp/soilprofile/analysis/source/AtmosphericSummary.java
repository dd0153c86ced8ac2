package com.ospicorp.soilprofile.analysis.source;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;

/**
 * Averages of a NASA POWER daily point document over the returned window. Each series is a
 * date-to-value object under {@code properties.parameter}; null, non-numeric and fill entries are
 * skipped, and a series without usable entries averages to null.
 */
public record AtmosphericSummary(
    Double meanTemperatureC,
    Double meanHumidityPct,
    Double meanPrecipitationMm
) {

  public static final String TEMPERATURE = "T2M";
  public static final String HUMIDITY = "RH2M";
  public static final String PRECIPITATION = "PRECTOTCORR";
  public static final String SHORTWAVE_RADIATION = "ALLSKY_SFC_SW_DWN";
  public static final String LONGWAVE_RADIATION = "ALLSKY_SFC_LW_DWN";

  /** POWER marks missing days with this value instead of null. */
  static final double FILL_VALUE = -999d;

  public static final AtmosphericSummary EMPTY = new AtmosphericSummary(null, null, null);

  public static AtmosphericSummary from(JsonNode payload) {
    JsonNode parameters = payload.path("properties").path("parameter");
    return new AtmosphericSummary(
        mean(parameters.get(TEMPERATURE)),
        mean(parameters.get(HUMIDITY)),
        mean(parameters.get(PRECIPITATION)));
  }

  private static Double mean(JsonNode series) {
    if (series == null || !series.isObject()) {
      return null;
    }
    double sum = 0d;
    int count = 0;
    for (Iterator<JsonNode> it = series.elements(); it.hasNext(); ) {
      Double value = JsonNumbers.read(it.next());
      if (value == null || value == FILL_VALUE) {
        continue;
      }
      sum += value;
      count++;
    }
    return count == 0 ? null : sum / count;
  }
}
