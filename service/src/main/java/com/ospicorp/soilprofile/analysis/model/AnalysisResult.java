package com.ospicorp.soilprofile.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one analysis request. Error outcomes keep the requested coordinate, carry
 * {@link DataQuality#INSUFFICIENT} and leave the measured sections null.
 */
public record AnalysisResult(
    double latitude,
    double longitude,
    AnalysisStatus status,
    EnvironmentalConditions environment,
    SoilProfile soil,
    @JsonProperty("data_quality") DataQuality quality,
    List<SourceStatus> sources,
    Instant timestamp,
    String error
) {

  public AnalysisResult {
    sources = sources == null ? List.of() : List.copyOf(sources);
  }

  public static AnalysisResult of(Coordinate coordinate, ProfileCore core, Instant timestamp) {
    return new AnalysisResult(coordinate.latitude(), coordinate.longitude(), AnalysisStatus.OK,
        core.environment(), core.soil(), core.quality(), core.sources(), timestamp, null);
  }

  public static AnalysisResult failure(double latitude, double longitude, AnalysisStatus status,
      String error, Instant timestamp) {
    return new AnalysisResult(latitude, longitude, status, null, null, DataQuality.INSUFFICIENT,
        List.of(), timestamp, error);
  }
}
