package com.ospicorp.soilprofile.analysis.source;

import com.ospicorp.soilprofile.analysis.fetch.FetchResult;
import com.ospicorp.soilprofile.analysis.fetch.ResilientFetcher;
import com.ospicorp.soilprofile.analysis.fetch.SourceRequest;
import com.ospicorp.soilprofile.analysis.model.Coordinate;
import com.ospicorp.soilprofile.config.SoilSourcesProperties;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Texture and chemistry of the topsoil from ISRIC SoilGrids.
 */
@Component
public class SoilPropertyAdapter implements SourceAdapter {

  static final List<String> PROPERTIES = List.of(
      SoilGridLayers.CLAY,
      SoilGridLayers.SAND,
      SoilGridLayers.SILT,
      SoilGridLayers.PH,
      SoilGridLayers.ORGANIC_CARBON);
  static final String TOPSOIL_DEPTH = "0-5cm";

  private final ResilientFetcher fetcher;
  private final SoilSourcesProperties.Source source;

  public SoilPropertyAdapter(ResilientFetcher fetcher, SoilSourcesProperties properties) {
    this.fetcher = fetcher;
    this.source = properties.soilGrids();
  }

  @Override
  public SourceKind kind() {
    return SourceKind.SOIL;
  }

  @Override
  public FetchResult fetch(Coordinate coordinate) {
    return fetcher.fetch(request(coordinate));
  }

  SourceRequest request(Coordinate coordinate) {
    UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(source.url())
        .queryParam("lat", coordinate.latitude())
        .queryParam("lon", coordinate.longitude());
    for (String property : PROPERTIES) {
      uri.queryParam("property", property);
    }
    uri.queryParam("depth", TOPSOIL_DEPTH)
        .queryParam("value", "mean");
    HttpHeaders headers = new HttpHeaders();
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    if (source.hasApiKey()) {
      headers.setBearerAuth(source.apiKey());
    }
    return new SourceRequest(kind().id(), uri.encode().build().toUri(), headers,
        source.timeout());
  }
}
