package com.ospicorp.soilprofile.analysis.source;

import com.ospicorp.soilprofile.analysis.fetch.FetchResult;
import com.ospicorp.soilprofile.analysis.model.Coordinate;

/**
 * Translates a coordinate into one source-specific request. Implementations return the fetch
 * outcome verbatim and never validate payload contents.
 */
public interface SourceAdapter {

  SourceKind kind();

  FetchResult fetch(Coordinate coordinate);
}
