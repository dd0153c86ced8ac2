package com.ospicorp.soilprofile.analysis.source;

import com.ospicorp.soilprofile.analysis.fetch.FetchResult;
import com.ospicorp.soilprofile.analysis.fetch.ResilientFetcher;
import com.ospicorp.soilprofile.analysis.fetch.SourceRequest;
import com.ospicorp.soilprofile.analysis.model.Coordinate;
import com.ospicorp.soilprofile.config.SoilSourcesProperties;
import java.net.URI;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Current conditions from OpenWeatherMap, in metric units.
 */
@Component
public class WeatherAdapter implements SourceAdapter {

  private final ResilientFetcher fetcher;
  private final SoilSourcesProperties.Source source;

  public WeatherAdapter(ResilientFetcher fetcher, SoilSourcesProperties properties) {
    this.fetcher = fetcher;
    this.source = properties.weather();
  }

  @Override
  public SourceKind kind() {
    return SourceKind.WEATHER;
  }

  @Override
  public FetchResult fetch(Coordinate coordinate) {
    return fetcher.fetch(request(coordinate));
  }

  SourceRequest request(Coordinate coordinate) {
    UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(source.url())
        .pathSegment("weather")
        .queryParam("lat", coordinate.latitude())
        .queryParam("lon", coordinate.longitude())
        .queryParam("units", "metric");
    if (source.hasApiKey()) {
      uri.queryParam("appid", source.apiKey());
    }
    HttpHeaders headers = new HttpHeaders();
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    URI endpoint = uri.encode().build().toUri();
    return new SourceRequest(kind().id(), endpoint, headers, source.timeout());
  }
}
