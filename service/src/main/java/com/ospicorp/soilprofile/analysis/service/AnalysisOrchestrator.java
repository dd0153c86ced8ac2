package com.ospicorp.soilprofile.analysis.service;

import com.ospicorp.soilprofile.analysis.fetch.FetchResult;
import com.ospicorp.soilprofile.analysis.model.AnalysisResult;
import com.ospicorp.soilprofile.analysis.model.AnalysisStatus;
import com.ospicorp.soilprofile.analysis.model.Coordinate;
import com.ospicorp.soilprofile.analysis.model.ProfileCore;
import com.ospicorp.soilprofile.analysis.source.SourceAdapter;
import com.ospicorp.soilprofile.analysis.source.SourceKind;
import com.ospicorp.soilprofile.config.SoilSourcesProperties;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point of an analysis. Validates the coordinate, queries every source concurrently, waits
 * for all of them and builds the profile. Never throws; faults become
 * {@link com.ospicorp.soilprofile.analysis.model.DataQuality#INSUFFICIENT} results.
 */
@Service
public class AnalysisOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

  private final Map<SourceKind, SourceAdapter> adapters;
  private final ProfileBuilder profileBuilder;
  private final Executor executor;
  private final Clock clock;
  private final Duration requestTimeout;

  @Autowired
  public AnalysisOrchestrator(List<SourceAdapter> adapters, ProfileBuilder profileBuilder,
      @Qualifier("sourceExecutor") Executor executor, Clock clock,
      SoilSourcesProperties properties) {
    this(adapters, profileBuilder, executor, clock, properties.analysis().requestTimeout());
  }

  public AnalysisOrchestrator(List<SourceAdapter> adapters, ProfileBuilder profileBuilder,
      Executor executor, Clock clock, Duration requestTimeout) {
    this.adapters = index(adapters);
    this.profileBuilder = profileBuilder;
    this.executor = executor;
    this.clock = clock;
    this.requestTimeout = requestTimeout;
  }

  public AnalysisResult analyze(double latitude, double longitude) {
    if (!Coordinate.isValid(latitude, longitude)) {
      String message = Coordinate.describeInvalid(latitude, longitude);
      log.warn("Rejected analysis request: {}", message);
      return AnalysisResult.failure(latitude, longitude, AnalysisStatus.INVALID_INPUT, message,
          clock.instant());
    }

    try {
      Coordinate coordinate = new Coordinate(latitude, longitude);
      Map<SourceKind, FetchResult> results = fetchAll(coordinate);
      ProfileCore core = profileBuilder.build(
          results.get(SourceKind.WEATHER),
          results.get(SourceKind.ATMOSPHERIC),
          results.get(SourceKind.SOIL));
      log.info("Analysis for ({}, {}) completed with quality {} and soil type {}",
          latitude, longitude, core.quality().label(), core.soil().soilType().label());
      return AnalysisResult.of(coordinate, core, clock.instant());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Analysis for ({}, {}) abandoned: caller interrupted", latitude, longitude);
      return AnalysisResult.failure(latitude, longitude, AnalysisStatus.INTERNAL_ERROR,
          "Analysis interrupted before all sources answered", clock.instant());
    } catch (RuntimeException ex) {
      log.error("Analysis for ({}, {}) failed: {}", latitude, longitude, ex.getMessage(), ex);
      return AnalysisResult.failure(latitude, longitude, AnalysisStatus.INTERNAL_ERROR,
          describe(ex), clock.instant());
    }
  }

  private Map<SourceKind, FetchResult> fetchAll(Coordinate coordinate)
      throws InterruptedException {
    Map<SourceKind, CompletableFuture<FetchResult>> pending = new EnumMap<>(SourceKind.class);
    for (Map.Entry<SourceKind, SourceAdapter> entry : adapters.entrySet()) {
      pending.put(entry.getKey(), submit(entry.getKey(), entry.getValue(), coordinate));
    }

    try {
      CompletableFuture.allOf(pending.values().toArray(new CompletableFuture<?>[0]))
          .get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      log.warn("Sources did not all answer within {}; continuing with what arrived",
          requestTimeout);
    } catch (ExecutionException ex) {
      throw new IllegalStateException("Source future failed despite fallback", ex.getCause());
    }

    Map<SourceKind, FetchResult> results = new EnumMap<>(SourceKind.class);
    for (SourceKind kind : SourceKind.values()) {
      CompletableFuture<FetchResult> future = pending.get(kind);
      if (future == null) {
        log.warn("No adapter registered for source {}", kind.id());
        results.put(kind, FetchResult.failed());
      } else if (!future.isDone()) {
        log.warn("Source {} abandoned after {}", kind.id(), requestTimeout);
        results.put(kind, FetchResult.failed());
      } else {
        results.put(kind, future.join());
      }
    }
    return results;
  }

  private CompletableFuture<FetchResult> submit(SourceKind kind, SourceAdapter adapter,
      Coordinate coordinate) {
    try {
      return CompletableFuture
          .supplyAsync(() -> adapter.fetch(coordinate), executor)
          .exceptionally(ex -> {
            log.warn("Source {} raised instead of reporting failure: {}",
                kind.id(), ex.getMessage());
            return FetchResult.failed();
          });
    } catch (RejectedExecutionException ex) {
      log.warn("Source {} not queried, executor is saturated: {}", kind.id(), ex.getMessage());
      return CompletableFuture.completedFuture(FetchResult.failed());
    }
  }

  private static Map<SourceKind, SourceAdapter> index(List<SourceAdapter> adapters) {
    Map<SourceKind, SourceAdapter> byKind = new EnumMap<>(SourceKind.class);
    for (SourceAdapter adapter : adapters) {
      SourceAdapter previous = byKind.put(adapter.kind(), adapter);
      if (previous != null) {
        throw new IllegalStateException("Duplicate adapter for source " + adapter.kind().id());
      }
    }
    return byKind;
  }

  private static String describe(Exception ex) {
    String message = ex.getMessage();
    if (message == null || message.isBlank()) {
      return ex.getClass().getName();
    }
    return ex.getClass().getSimpleName() + ": " + message;
  }
}
