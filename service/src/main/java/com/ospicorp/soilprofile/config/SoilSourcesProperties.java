package com.ospicorp.soilprofile.config;

import com.ospicorp.soilprofile.analysis.fetch.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * External source endpoints and the retry, timeout and concurrency settings around them.
 *
 * <p>Bound from the {@code soil.*} namespace. API keys are passed to the sources unmodified and
 * omitted from requests when blank.
 */
@Validated
@ConfigurationProperties(prefix = "soil")
public record SoilSourcesProperties(
    @Valid Source weather,
    @Valid Source atmospheric,
    @Valid Source soilGrids,
    @Valid Fetch fetch,
    @Valid Analysis analysis
) {

  static final Duration DEFAULT_SOURCE_TIMEOUT = Duration.ofSeconds(30);
  static final Duration REQUEST_TIMEOUT_MARGIN = Duration.ofSeconds(10);

  public SoilSourcesProperties {
    weather = weather != null ? weather
        : new Source("https://api.openweathermap.org/data/2.5", null, null);
    atmospheric = atmospheric != null ? atmospheric
        : new Source("https://power.larc.nasa.gov/api/temporal/daily/point", null, null);
    soilGrids = soilGrids != null ? soilGrids
        : new Source("https://rest.isric.org/soilgrids/v2.0/properties/query", null, null);
    fetch = fetch != null ? fetch : new Fetch(null, null);
    analysis = analysis != null ? analysis : new Analysis(null, null);
    if (analysis.requestTimeout() == null) {
      analysis = new Analysis(
          worstCaseFetch(fetch.toRetryPolicy(), weather, atmospheric, soilGrids)
              .plus(REQUEST_TIMEOUT_MARGIN),
          analysis.sourceThreads());
    }
  }

  /**
   * Longest a single source can take before its fetcher gives up: every attempt spends its full
   * connect and read timeout, plus the backoff between attempts.
   */
  static Duration worstCaseFetch(RetryPolicy policy, Source... sources) {
    Duration slowestAttempt = Duration.ZERO;
    for (Source source : sources) {
      Duration attempt = source.timeout().multipliedBy(2);
      if (attempt.compareTo(slowestAttempt) > 0) {
        slowestAttempt = attempt;
      }
    }
    Duration total = slowestAttempt.multipliedBy(policy.maxRetries());
    for (int attempt = 1; policy.hasAttemptAfter(attempt); attempt++) {
      total = total.plus(policy.delayAfter(attempt));
    }
    return total;
  }

  /**
   * @param url base URL of the source
   * @param apiKey opaque credential, may be blank
   * @param timeout connect and read timeout per attempt
   */
  public record Source(@NotBlank String url, String apiKey, Duration timeout) {
    public Source {
      timeout = timeout != null ? timeout : DEFAULT_SOURCE_TIMEOUT;
    }

    public boolean hasApiKey() {
      return apiKey != null && !apiKey.isBlank();
    }
  }

  public record Fetch(@Min(1) Integer maxRetries, Duration baseDelay) {
    public Fetch {
      maxRetries = maxRetries != null ? maxRetries : RetryPolicy.DEFAULT_MAX_RETRIES;
      baseDelay = baseDelay != null ? baseDelay : RetryPolicy.DEFAULT_BASE_DELAY;
    }

    public RetryPolicy toRetryPolicy() {
      return new RetryPolicy(maxRetries, baseDelay);
    }
  }

  /**
   * @param requestTimeout how long one analysis waits for all sources before treating the
   *     unfinished ones as unavailable; when unset, the worst case of the slowest source's retries
   *     plus a small margin
   * @param sourceThreads size of the pool running source calls
   */
  public record Analysis(Duration requestTimeout, @Min(1) Integer sourceThreads) {
    public Analysis {
      sourceThreads = sourceThreads != null ? sourceThreads : 12;
    }
  }
}
