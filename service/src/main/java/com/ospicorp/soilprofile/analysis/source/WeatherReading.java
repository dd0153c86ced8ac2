package com.ospicorp.soilprofile.analysis.source;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Current-conditions fields consumed from an OpenWeatherMap {@code /weather} document. Absent or
 * malformed fields are null.
 */
public record WeatherReading(Double temperatureC, Double humidityPct) {

  public static final WeatherReading EMPTY = new WeatherReading(null, null);

  public static WeatherReading from(JsonNode payload) {
    JsonNode main = payload.path("main");
    return new WeatherReading(
        JsonNumbers.read(main.get("temp")),
        JsonNumbers.read(main.get("humidity")));
  }
}
