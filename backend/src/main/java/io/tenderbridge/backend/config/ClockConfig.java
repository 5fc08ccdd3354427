package io.tenderbridge.backend.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

  /** UTC system clock. Tests replace it with a fixed or mutable clock. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
