package com.ospicorp.soilprofile.analysis.controller;

import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.soilprofile.analysis.fetch.SourceRequest;
import com.ospicorp.soilprofile.analysis.fetch.SourceTransport;
import com.ospicorp.soilprofile.analysis.source.PayloadFixtures;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class AnalysisControllerTest {

  private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
      new ParameterizedTypeReference<>() {};

  @Autowired
  private TestRestTemplate restTemplate;

  @MockBean
  private SourceTransport transport;

  private static JsonNode recorded(SourceRequest request) {
    return switch (request.source()) {
      case "weather" -> PayloadFixtures.weather();
      case "atmospheric" -> PayloadFixtures.atmospheric();
      case "soil" -> PayloadFixtures.soil();
      default -> throw new IllegalArgumentException(request.source());
    };
  }

  private ResponseEntity<Map<String, Object>> get(String url) {
    return restTemplate.exchange(url, HttpMethod.GET, null, JSON_MAP);
  }

  @Test
  @SuppressWarnings("unchecked")
  void analysisWithAllSourcesIsHighQuality() {
    given(transport.exchange(any())).willAnswer(inv -> recorded(inv.getArgument(0)));

    var response = get("/v1/analysis?lat=20.5937&lon=78.9629");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getFirst("X-Request-Id")).isNotBlank();
    Map<String, Object> body = requireNonNull(response.getBody());
    assertThat(body).containsEntry("status", "OK")
        .containsEntry("data_quality", "High")
        .containsEntry("latitude", 20.5937)
        .containsEntry("longitude", 78.9629);
    assertThat(body.get("timestamp")).isInstanceOf(String.class);

    var soil = (Map<String, Object>) body.get("soil");
    assertThat(soil).containsEntry("soil_type", "Clay Loam");
    assertThat((Map<String, Object>) soil.get("ph")).containsEntry("value", 6.5)
        .containsEntry("valid", true);

    var environment = (Map<String, Object>) body.get("environment");
    assertThat((Map<String, Object>) environment.get("temperature_c"))
        .containsEntry("value", 27.4);

    var sources = (List<Map<String, Object>>) body.get("sources");
    assertThat(sources).extracting(source -> source.get("source"))
        .containsExactly("weather", "atmospheric", "soil");
  }

  @Test
  void unreachableSourcesDegradeToInsufficient() {
    given(transport.exchange(any())).willThrow(new ResourceAccessException("Connection refused"));

    var response = get("/v1/analysis?lat=-33.8688&lon=151.2093");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("data_quality", "Insufficient")
        .containsEntry("status", "OK");
    verify(transport, atLeastOnce()).exchange(any());
  }

  @Test
  void outOfRangeCoordinateIsRejectedWithoutCallingSources() {
    var response = get("/v1/analysis?lat=200&lon=0");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("status", "INVALID_INPUT")
        .containsEntry("data_quality", "Insufficient");
    assertThat((String) response.getBody().get("error")).contains("latitude");
    verify(transport, never()).exchange(any());
  }

  @Test
  void malformedCoordinateIsProblemDetail() {
    var response = get("/v1/analysis?lat=abc&lon=0");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(String.valueOf(response.getHeaders().getContentType()))
        .contains(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
    assertThat(response.getBody()).containsEntry("detail", "Parameter 'lat' must be a number")
        .containsKeys("type", "title", "status", "instance");
  }

  @Test
  void missingCoordinateIsProblemDetail() {
    var response = get("/v1/analysis?lat=10");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("detail", "Parameter 'lon' is required");
  }

  @Test
  void jsonBodyIsAccepted() {
    given(transport.exchange(any())).willAnswer(inv -> recorded(inv.getArgument(0)));
    var headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    var entity = new HttpEntity<>(Map.of("latitude", 20.5937, "longitude", 78.9629), headers);

    var response = restTemplate.exchange("/v1/analysis", HttpMethod.POST, entity, JSON_MAP);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("data_quality", "High");
  }

  @Test
  void incompleteJsonBodyIsProblemDetail() {
    var headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    var entity = new HttpEntity<>(Map.of("latitude", 20.5937), headers);

    var response = restTemplate.exchange("/v1/analysis", HttpMethod.POST, entity, JSON_MAP);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat((String) response.getBody().get("detail")).contains("longitude");
    verify(transport, never()).exchange(any());
  }
}
