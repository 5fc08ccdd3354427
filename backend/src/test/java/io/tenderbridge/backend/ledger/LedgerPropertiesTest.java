package io.tenderbridge.backend.ledger;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class LedgerPropertiesTest {

  private final LedgerProperties.Jobs jobs =
      LedgerTestProperties.jobs(6, Duration.ofSeconds(30), Duration.ofMinutes(5), 2.0);

  @Test
  void backoffFor_doublesPerAttempt() {
    assertThat(jobs.backoffFor(1)).isEqualTo(Duration.ofSeconds(30));
    assertThat(jobs.backoffFor(2)).isEqualTo(Duration.ofSeconds(60));
    assertThat(jobs.backoffFor(3)).isEqualTo(Duration.ofSeconds(120));
  }

  @Test
  void backoffFor_isCappedAtMaxBackoff() {
    assertThat(jobs.backoffFor(5)).isEqualTo(Duration.ofMinutes(5));
    assertThat(jobs.backoffFor(500)).isEqualTo(Duration.ofMinutes(5));
  }

  @Test
  void backoffFor_attemptZeroUsesInitialBackoff() {
    assertThat(jobs.backoffFor(0)).isEqualTo(Duration.ofSeconds(30));
  }
}
