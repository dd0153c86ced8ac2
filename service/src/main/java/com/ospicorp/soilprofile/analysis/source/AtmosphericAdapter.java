package com.ospicorp.soilprofile.analysis.source;

import com.ospicorp.soilprofile.analysis.fetch.FetchResult;
import com.ospicorp.soilprofile.analysis.fetch.ResilientFetcher;
import com.ospicorp.soilprofile.analysis.fetch.SourceRequest;
import com.ospicorp.soilprofile.analysis.model.Coordinate;
import com.ospicorp.soilprofile.config.SoilSourcesProperties;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Trailing seven days of daily aggregates from the NASA POWER agroclimatology community.
 */
@Component
public class AtmosphericAdapter implements SourceAdapter {

  static final int WINDOW_DAYS = 7;
  static final DateTimeFormatter POWER_DATE = DateTimeFormatter.BASIC_ISO_DATE;
  static final List<String> PARAMETERS = List.of(
      AtmosphericSummary.TEMPERATURE,
      AtmosphericSummary.HUMIDITY,
      AtmosphericSummary.PRECIPITATION,
      AtmosphericSummary.SHORTWAVE_RADIATION,
      AtmosphericSummary.LONGWAVE_RADIATION);

  private final ResilientFetcher fetcher;
  private final SoilSourcesProperties.Source source;
  private final Clock clock;

  public AtmosphericAdapter(ResilientFetcher fetcher, SoilSourcesProperties properties,
      Clock clock) {
    this.fetcher = fetcher;
    this.source = properties.atmospheric();
    this.clock = clock;
  }

  @Override
  public SourceKind kind() {
    return SourceKind.ATMOSPHERIC;
  }

  @Override
  public FetchResult fetch(Coordinate coordinate) {
    return fetcher.fetch(request(coordinate));
  }

  SourceRequest request(Coordinate coordinate) {
    LocalDate end = LocalDate.now(clock);
    LocalDate start = end.minusDays(WINDOW_DAYS);
    UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(source.url())
        .queryParam("start", start.format(POWER_DATE))
        .queryParam("end", end.format(POWER_DATE))
        .queryParam("latitude", coordinate.latitude())
        .queryParam("longitude", coordinate.longitude())
        .queryParam("community", "AG")
        .queryParam("parameters", String.join(",", PARAMETERS))
        .queryParam("format", "JSON");
    if (source.hasApiKey()) {
      uri.queryParam("api_key", source.apiKey());
    }
    HttpHeaders headers = new HttpHeaders();
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    return new SourceRequest(kind().id(), uri.encode().build().toUri(), headers,
        source.timeout());
  }
}
