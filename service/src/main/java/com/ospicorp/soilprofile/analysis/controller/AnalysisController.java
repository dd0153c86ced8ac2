package com.ospicorp.soilprofile.analysis.controller;

import com.ospicorp.soilprofile.analysis.model.AnalysisRequest;
import com.ospicorp.soilprofile.analysis.model.AnalysisResult;
import com.ospicorp.soilprofile.analysis.service.AnalysisOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/analysis")
@Validated
@Tag(name = "Analysis")
public class AnalysisController {

  private final AnalysisOrchestrator orchestrator;

  public AnalysisController(AnalysisOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @GetMapping
  @Operation(summary = "Analyze a location",
      description = "Aggregate weather, reanalysis and soil-grid data for a point into a validated soil profile.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Profile, possibly degraded",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = AnalysisResult.class))),
      @ApiResponse(responseCode = "400", description = "Coordinate out of range or malformed",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = AnalysisResult.class)),
              @Content(mediaType = "application/problem+json",
                  schema = @Schema(implementation = org.springframework.http.ProblemDetail.class))
          }),
      @ApiResponse(responseCode = "500", description = "Unexpected internal fault",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = AnalysisResult.class)))
  })
  public ResponseEntity<AnalysisResult> analyze(
      @RequestParam("lat") @Parameter(description = "Latitude in decimal degrees", example = "20.5937") double latitude,
      @RequestParam("lon") @Parameter(description = "Longitude in decimal degrees", example = "78.9629") double longitude) {
    return respond(orchestrator.analyze(latitude, longitude));
  }

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Analyze a location (JSON body)")
  public ResponseEntity<AnalysisResult> analyze(@Valid @RequestBody AnalysisRequest request) {
    return respond(orchestrator.analyze(request.latitude(), request.longitude()));
  }

  private ResponseEntity<AnalysisResult> respond(AnalysisResult result) {
    HttpStatus status = switch (result.status()) {
      case OK -> HttpStatus.OK;
      case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
      case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
    return ResponseEntity.status(status).body(result);
  }
}
