package com.ospicorp.soilprofile.config;

import com.ospicorp.soilprofile.analysis.fetch.ResilientFetcher;
import com.ospicorp.soilprofile.analysis.fetch.RestTemplateSourceTransport;
import com.ospicorp.soilprofile.analysis.fetch.Sleeper;
import com.ospicorp.soilprofile.analysis.fetch.SourceTransport;
import java.time.Clock;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Outbound plumbing shared by the source adapters: HTTP transport, retry wrapper, the pool the
 * calls run on, and the clock used for request windows and result timestamps.
 */
@Configuration
public class SourceClientConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  SourceTransport sourceTransport(RestTemplateBuilder builder) {
    return new RestTemplateSourceTransport(builder);
  }

  @Bean
  Sleeper backoffSleeper() {
    return Sleeper.threadSleep();
  }

  @Bean
  ResilientFetcher resilientFetcher(SourceTransport transport, Sleeper sleeper,
      SoilSourcesProperties properties) {
    return new ResilientFetcher(transport, properties.fetch().toRetryPolicy(), sleeper);
  }

  @Bean(name = "sourceExecutor")
  ThreadPoolTaskExecutor sourceExecutor(SoilSourcesProperties properties) {
    int threads = properties.analysis().sourceThreads();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(threads * 16);
    executor.setThreadNamePrefix("source-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    return executor;
  }
}
