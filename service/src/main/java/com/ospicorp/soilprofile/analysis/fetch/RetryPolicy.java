package com.ospicorp.soilprofile.analysis.fetch;

import java.time.Duration;

/**
 * Bounded retry with linear backoff: after failed attempt {@code n} the caller waits
 * {@code baseDelay * n} before attempt {@code n + 1}.
 *
 * @param maxRetries total number of attempts, at least one
 * @param baseDelay backoff unit, zero disables waiting
 */
public record RetryPolicy(int maxRetries, Duration baseDelay) {

  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(2);

  public RetryPolicy {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be at least 1");
    }
    if (baseDelay == null || baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must not be negative");
    }
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY);
  }

  public boolean hasAttemptAfter(int attempt) {
    return attempt < maxRetries;
  }

  public Duration delayAfter(int attempt) {
    return baseDelay.multipliedBy(attempt);
  }
}
