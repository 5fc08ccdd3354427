package io.tenderbridge.backend.ledger;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings for the award ledger and the commit job queue, bound from {@code tenderbridge.ledger.*}.
 *
 * @param provider {@code local} (in-process, the default) or {@code web3j}
 * @param minorUnitScale decimal places used when converting award amounts to integer minor units
 */
@ConfigurationProperties(prefix = "tenderbridge.ledger")
public record LedgerProperties(
    @DefaultValue("local") String provider,
    @DefaultValue("2") int minorUnitScale,
    @DefaultValue("900000") long sweepInterval,
    @DefaultValue Chain chain,
    @DefaultValue Jobs jobs) {

  /** Connection settings for the EVM award contract. Only read when the provider is web3j. */
  public record Chain(
      @DefaultValue("http://localhost:8545") String rpcUrl,
      String contractAddress,
      String privateKey,
      @DefaultValue("1337") long chainId,
      @DefaultValue("1000000") long gasLimit,
      @DefaultValue("1s") Duration receiptPollInterval,
      @DefaultValue("40") int receiptPollAttempts) {}

  /** Retry policy of the award commit queue. */
  public record Jobs(
      @DefaultValue("5000") long pollInterval,
      @DefaultValue("10") int batchSize,
      @DefaultValue("6") int maxAttempts,
      @DefaultValue("30s") Duration initialBackoff,
      @DefaultValue("1h") Duration maxBackoff,
      @DefaultValue("2.0") double backoffMultiplier,
      @DefaultValue("10m") Duration runningTimeout) {

    /** Delay before retry number {@code attempt} (1-based), capped at {@link #maxBackoff()}. */
    public Duration backoffFor(int attempt) {
      double factor = Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
      double millis = initialBackoff.toMillis() * factor;
      if (Double.isInfinite(millis) || millis >= maxBackoff.toMillis()) {
        return maxBackoff;
      }
      return Duration.ofMillis((long) millis);
    }
  }
}
