package com.ospicorp.soilprofile.analysis.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link SourceTransport} backed by {@link RestTemplate}. Timeouts live on the request factory, so
 * one template is built per distinct timeout and reused.
 */
public class RestTemplateSourceTransport implements SourceTransport {

  private final Function<Duration, RestTemplate> templateFactory;
  private final Map<Duration, RestTemplate> templates = new ConcurrentHashMap<>();

  public RestTemplateSourceTransport(RestTemplateBuilder builder) {
    this(timeout -> builder
        .setConnectTimeout(timeout)
        .setReadTimeout(timeout)
        .build());
  }

  RestTemplateSourceTransport(Function<Duration, RestTemplate> templateFactory) {
    this.templateFactory = templateFactory;
  }

  @Override
  public JsonNode exchange(SourceRequest request) throws RestClientException {
    RestTemplate restTemplate = templates.computeIfAbsent(request.timeout(), templateFactory);
    HttpEntity<Void> entity = new HttpEntity<>(request.headers());
    ResponseEntity<JsonNode> response = restTemplate.exchange(request.endpoint(), HttpMethod.GET,
        entity, JsonNode.class);
    if (!response.getStatusCode().is2xxSuccessful()) {
      throw new SourceResponseException(request.source(), response.getStatusCode());
    }
    return response.getBody();
  }
}
