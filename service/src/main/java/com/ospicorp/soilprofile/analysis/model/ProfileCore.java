package com.ospicorp.soilprofile.analysis.model;

import java.util.List;

/**
 * Merged profile before it is stamped with a coordinate and time.
 */
public record ProfileCore(
    EnvironmentalConditions environment,
    SoilProfile soil,
    DataQuality quality,
    List<SourceStatus> sources
) {

  public ProfileCore {
    sources = List.copyOf(sources);
  }
}
