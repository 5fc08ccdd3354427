package io.tenderbridge.backend.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tenderbridge.backend.bid.BidFixtures;
import io.tenderbridge.backend.tender.TenderFixtures;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AwardPayloadHasherTest {

  private final AwardPayloadHasher hasher = new AwardPayloadHasher(LedgerTestProperties.defaults());

  private AwardFacts sampleFacts() {
    return new AwardFacts(
        "7d1c0b9e-2f3a-4c55-9d0e-1a2b3c4d5e6f",
        "Road resurfacing",
        "0f9e8d7c-6b5a-4a39-8271-605f4e3d2c1b",
        "11111111-2222-4333-8444-555555555555",
        1_250_000L,
        "2026-03-01T10:00:00.123456Z",
        "99999999-8888-4777-8666-555555555555");
  }

  @Test
  void canonicalJson_sortsKeysAndHasNoWhitespace() {
    var json = hasher.canonicalJson(sampleFacts());

    assertThat(json)
        .isEqualTo(
            "{\"award_amount\":1250000,"
                + "\"awarded_at\":\"2026-03-01T10:00:00.123456Z\","
                + "\"posted_by\":\"99999999-8888-4777-8666-555555555555\","
                + "\"tender_id\":\"7d1c0b9e-2f3a-4c55-9d0e-1a2b3c4d5e6f\","
                + "\"tender_title\":\"Road resurfacing\","
                + "\"winning_bid_id\":\"0f9e8d7c-6b5a-4a39-8271-605f4e3d2c1b\","
                + "\"winning_company_id\":\"11111111-2222-4333-8444-555555555555\"}");
  }

  @Test
  void contentHash_isPrefixedLowerCaseSha256() {
    var hash = hasher.contentHash(sampleFacts());

    assertThat(hash).matches("0x[0-9a-f]{64}");
  }

  @Test
  void contentHash_isDeterministicForEqualFacts() {
    assertThat(hasher.contentHash(sampleFacts())).isEqualTo(hasher.contentHash(sampleFacts()));
  }

  @Test
  void contentHash_changesWhenAnyFactChanges() {
    var base = sampleFacts();
    var otherAmount =
        new AwardFacts(
            base.tenderId(),
            base.tenderTitle(),
            base.winningBidId(),
            base.winningCompanyId(),
            base.awardAmount() + 1,
            base.awardedAt(),
            base.postedBy());

    assertThat(hasher.contentHash(otherAmount)).isNotEqualTo(hasher.contentHash(base));
  }

  @Test
  void sha256Hex_matchesKnownDigest() {
    assertThat(AwardPayloadHasher.sha256Hex("abc"))
        .isEqualTo("0xba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
  }

  @Test
  void toMinorUnits_roundsHalfUp() {
    assertThat(hasher.toMinorUnits(new BigDecimal("12500.00"))).isEqualTo(1_250_000L);
    assertThat(hasher.toMinorUnits(new BigDecimal("0.005"))).isEqualTo(1L);
    assertThat(hasher.toMinorUnits(new BigDecimal("0.004"))).isEqualTo(0L);
    assertThat(hasher.toMinorUnits(new BigDecimal("7"))).isEqualTo(700L);
  }

  @Test
  void formatInstant_truncatesToMicros() {
    assertThat(AwardPayloadHasher.formatInstant(Instant.parse("2026-03-01T10:00:00.123456789Z")))
        .isEqualTo("2026-03-01T10:00:00.123456Z");
  }

  @Test
  void factsFor_awardedTender_usesWinningBidAndAwardMetadata() {
    var awardedAt = Instant.parse("2026-03-01T10:00:00.123456Z");
    var tenderId = UUID.randomUUID();
    var bidId = UUID.randomUUID();
    var companyId = UUID.randomUUID();
    var owner = UUID.randomUUID();
    var tender = TenderFixtures.awarded(tenderId, owner, bidId, UUID.randomUUID(), awardedAt);
    var bid = BidFixtures.bid(bidId, tenderId, companyId, "999.999", awardedAt);

    var facts = hasher.factsFor(tender, bid);

    assertThat(facts.tenderId()).isEqualTo(tenderId.toString());
    assertThat(facts.winningBidId()).isEqualTo(bidId.toString());
    assertThat(facts.winningCompanyId()).isEqualTo(companyId.toString());
    assertThat(facts.awardAmount()).isEqualTo(100_000L);
    assertThat(facts.awardedAt()).isEqualTo("2026-03-01T10:00:00.123456Z");
    assertThat(facts.postedBy()).isEqualTo(owner.toString());
  }

  @Test
  void factsFor_nonWinningBid_throws() {
    var now = Instant.parse("2026-03-01T10:00:00Z");
    var tenderId = UUID.randomUUID();
    var tender =
        TenderFixtures.awarded(
            tenderId, UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), now);
    var otherBid = BidFixtures.bid(UUID.randomUUID(), tenderId, UUID.randomUUID(), "10", now);

    assertThatThrownBy(() -> hasher.factsFor(tender, otherBid))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
