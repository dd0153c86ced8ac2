package com.ospicorp.soilprofile.openapi;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.Objects;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ProblemDetailsHandlerTest {

  private static final ParameterizedTypeReference<Map<String, Object>> PROBLEM =
      new ParameterizedTypeReference<Map<String, Object>>() {};

  @Autowired
  private TestRestTemplate rest;

  @Test
  void invalidParameterReturnsProblemDetail() {
    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/analysis?lat=north&lon=0",
        HttpMethod.GET,
        null,
        PROBLEM);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    MediaType contentType = Objects.requireNonNull(response.getHeaders().getContentType());
    assertThat(contentType.toString()).contains("application/problem+json");
    Map<String, Object> body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body).containsKeys("type", "title", "status", "detail", "instance");
    assertThat(body.get("type").toString()).endsWith("/bad-request");
  }

  @Test
  void unknownPathReturnsNotFoundProblem() {
    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/nothing-here", HttpMethod.GET, null, PROBLEM);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody()).containsEntry("status", 404);
  }

  @Test
  void unsupportedMethodReturnsProblem() {
    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/analysis?lat=1&lon=1", HttpMethod.DELETE, null, PROBLEM);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
  }
}
