package io.tenderbridge.backend.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tenderbridge.backend.exception.LedgerUnavailableException;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class LocalAwardLedgerClientTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private final LocalAwardLedgerClient client =
      new LocalAwardLedgerClient(Clock.fixed(NOW, ZoneOffset.UTC));

  private static AwardLedgerEntry entry(String tenderId, String hash) {
    return new AwardLedgerEntry(tenderId, "bid-1", "company-1", 1_250_000L, hash);
  }

  @Test
  void recordAward_storesAwardReadableFromStorage() {
    var receipt = client.recordAward(entry("tender-1", "0xaa"));

    assertThat(receipt.contentHash()).isEqualTo("0xaa");
    assertThat(receipt.commitRef()).matches("0x[0-9a-f]{64}");
    assertThat(receipt.blockNumber()).isEqualTo(1L);

    var award = client.getAward("tender-1").orElseThrow();
    assertThat(award.winningBidId()).isEqualTo("bid-1");
    assertThat(award.awardAmount()).isEqualTo(BigInteger.valueOf(1_250_000L));
    assertThat(award.awardDate()).isEqualTo(NOW.getEpochSecond());
    assertThat(award.method()).isEqualTo(LedgerQueryMethod.CONTRACT_STORAGE);
    assertThat(award.commitRef()).isEqualTo(receipt.commitRef());
  }

  @Test
  void recordAward_sameHashTwice_returnsOriginalReceipt() {
    var first = client.recordAward(entry("tender-1", "0xaa"));
    var second = client.recordAward(entry("tender-1", "0xaa"));

    assertThat(second).isEqualTo(first);
  }

  @Test
  void recordAward_differentHashForSameTender_isRejected() {
    client.recordAward(entry("tender-1", "0xaa"));

    assertThatThrownBy(() -> client.recordAward(entry("tender-1", "0xbb")))
        .isInstanceOf(LedgerUnavailableException.class);
    assertThat(client.getAward("tender-1").orElseThrow().contentHash()).isEqualTo("0xaa");
  }

  @Test
  void getAwardByCommitRef_readsFromLogs() {
    var receipt = client.recordAward(entry("tender-1", "0xaa"));

    var award = client.getAwardByCommitRef(receipt.commitRef()).orElseThrow();

    assertThat(award.tenderId()).isEqualTo("tender-1");
    assertThat(award.method()).isEqualTo(LedgerQueryMethod.TRANSACTION_LOGS);
  }

  @Test
  void unknownLookups_returnEmpty() {
    assertThat(client.getAward("missing")).isEmpty();
    assertThat(client.getAwardByCommitRef("0xdead")).isEmpty();
  }

  @Test
  void blockNumbers_increasePerAward() {
    var first = client.recordAward(entry("tender-1", "0xaa"));
    var second = client.recordAward(entry("tender-2", "0xbb"));

    assertThat(second.blockNumber()).isGreaterThan(first.blockNumber());
    assertThat(second.commitRef()).isNotEqualTo(first.commitRef());
  }
}
