package com.ospicorp.soilprofile.analysis.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one logical source call with bounded retries. Every failure mode ends in
 * {@link FetchResult#failed()}; nothing is thrown to the caller.
 */
public class ResilientFetcher {

  private static final Logger log = LoggerFactory.getLogger(ResilientFetcher.class);

  private final SourceTransport transport;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;

  public ResilientFetcher(SourceTransport transport, RetryPolicy retryPolicy, Sleeper sleeper) {
    this.transport = transport;
    this.retryPolicy = retryPolicy;
    this.sleeper = sleeper;
  }

  public FetchResult fetch(SourceRequest request) {
    for (int attempt = 1; attempt <= retryPolicy.maxRetries(); attempt++) {
      try {
        JsonNode payload = transport.exchange(request);
        if (attempt > 1) {
          log.info("Source {} succeeded on attempt {}/{}", request.source(), attempt,
              retryPolicy.maxRetries());
        }
        return FetchResult.success(payload);
      } catch (RuntimeException ex) {
        log.warn("Source {} attempt {}/{} failed for {}: {}",
            request.source(),
            attempt,
            retryPolicy.maxRetries(),
            request.endpoint().getPath(),
            describe(ex));
      }

      if (retryPolicy.hasAttemptAfter(attempt)) {
        try {
          sleeper.sleep(retryPolicy.delayAfter(attempt));
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          log.warn("Source {} retry interrupted after attempt {}", request.source(), attempt);
          return FetchResult.failed();
        }
      }
    }
    log.warn("Source {} unavailable after {} attempts", request.source(),
        retryPolicy.maxRetries());
    return FetchResult.failed();
  }

  private static String describe(RuntimeException ex) {
    String message = ex.getMessage();
    if (message == null || message.isBlank()) {
      return ex.getClass().getName();
    }
    return message;
  }
}
