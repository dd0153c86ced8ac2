package com.ospicorp.soilprofile.web;

import io.swagger.v3.oas.annotations.Hidden;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Hidden
public class RootController {

  @GetMapping("/")
  public Map<String, Object> root() {
    return Map.of(
        "service", "soil-profile-service",
        "status", "ok",
        "analysis", "/v1/analysis?lat={lat}&lon={lon}",
        "docs", "/v3/api-docs");
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
