package com.ospicorp.soilprofile.analysis.fetch;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import org.springframework.http.HttpHeaders;

/**
 * One logical GET against an external source.
 *
 * @param source  short source name, used in logs
 * @param endpoint fully built URI including the query string
 * @param headers request headers, may be empty
 * @param timeout connect and read timeout applied to every attempt
 */
public record SourceRequest(String source, URI endpoint, HttpHeaders headers, Duration timeout) {

  public SourceRequest {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(endpoint, "endpoint");
    headers = headers == null ? HttpHeaders.EMPTY : HttpHeaders.readOnlyHttpHeaders(headers);
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive for source " + source);
    }
  }
}
