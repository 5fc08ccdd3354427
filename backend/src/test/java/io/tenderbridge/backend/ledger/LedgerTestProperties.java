package io.tenderbridge.backend.ledger;

import java.time.Duration;

/** Ledger settings matching the bound defaults, for unit tests. */
public final class LedgerTestProperties {

  private LedgerTestProperties() {}

  public static LedgerProperties defaults() {
    return withJobs(jobs(6, Duration.ofSeconds(30), Duration.ofHours(1), 2.0));
  }

  public static LedgerProperties withJobs(LedgerProperties.Jobs jobs) {
    return new LedgerProperties(
        "local",
        2,
        900_000L,
        new LedgerProperties.Chain(
            "http://localhost:8545", null, null, 1337L, 1_000_000L, Duration.ofSeconds(1), 40),
        jobs);
  }

  public static LedgerProperties.Jobs jobs(
      int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {
    return new LedgerProperties.Jobs(
        5000L, 10, maxAttempts, initialBackoff, maxBackoff, multiplier, Duration.ofMinutes(10));
  }
}
