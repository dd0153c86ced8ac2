package com.ospicorp.soilprofile.analysis.fetch;

import java.time.Duration;

/**
 * Blocks the calling thread between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper threadSleep() {
    return duration -> {
      if (!duration.isZero() && !duration.isNegative()) {
        Thread.sleep(duration.toMillis());
      }
    };
  }
}
