package com.ospicorp.soilprofile.analysis.fetch;

import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClientException;

public class SourceResponseException extends RestClientException {
  private final HttpStatusCode statusCode;

  public SourceResponseException(String source, HttpStatusCode statusCode) {
    super("Source " + source + " answered with status " + statusCode.value());
    this.statusCode = statusCode;
  }

  public HttpStatusCode statusCode() {
    return statusCode;
  }
}
