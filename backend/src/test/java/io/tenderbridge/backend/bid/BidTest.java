package io.tenderbridge.backend.bid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tenderbridge.backend.exception.InvalidStateException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class BidTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final UUID TENDER_ID = UUID.randomUUID();
  private static final UUID COMPANY_ID = UUID.randomUUID();

  @Test
  void constructor_createsPendingFirstRevision() {
    var bid = new Bid(TENDER_ID, COMPANY_ID, UUID.randomUUID(), new BigDecimal("100"), "doc", NOW);

    assertThat(bid.getStatus()).isEqualTo(BidStatus.PENDING);
    assertThat(bid.getRevisionNumber()).isEqualTo(1);
    assertThat(bid.getParentBidId()).isNull();
    assertThat(bid.getSubmittedAt()).isEqualTo(NOW);
  }

  @Test
  void nextRevision_pointsToParentAndCarriesDocument() {
    var original = BidFixtures.bid(UUID.randomUUID(), TENDER_ID, COMPANY_ID, "100.00", NOW);
    var withDoc =
        new Bid(TENDER_ID, COMPANY_ID, UUID.randomUUID(), new BigDecimal("100"), "tech.pdf", NOW);
    BidFixtures.setId(withDoc, UUID.randomUUID());

    var revised = withDoc.nextRevision(UUID.randomUUID(), new BigDecimal("90"), null, NOW);
    var replacedDoc = original.nextRevision(UUID.randomUUID(), new BigDecimal("95"), "v2.pdf", NOW);

    assertThat(revised.getRevisionNumber()).isEqualTo(2);
    assertThat(revised.getParentBidId()).isEqualTo(withDoc.getId());
    assertThat(revised.getDocumentRef()).isEqualTo("tech.pdf");
    assertThat(revised.getStatus()).isEqualTo(BidStatus.PENDING);
    assertThat(replacedDoc.getDocumentRef()).isEqualTo("v2.pdf");
  }

  @Test
  void nextRevision_requiresPersistedBid() {
    var bid = new Bid(TENDER_ID, COMPANY_ID, UUID.randomUUID(), BigDecimal.TEN, null, NOW);

    assertThatThrownBy(() -> bid.nextRevision(UUID.randomUUID(), BigDecimal.ONE, null, NOW))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void withdrawnBid_cannotBeAcceptedRejectedOrRevised() {
    var bid = BidFixtures.bid(UUID.randomUUID(), TENDER_ID, COMPANY_ID, "100", NOW);
    bid.markWithdrawn("no capacity", NOW);

    assertThat(bid.getWithdrawalReason()).isEqualTo("no capacity");
    assertThat(bid.getWithdrawnAt()).isEqualTo(NOW);
    assertThatThrownBy(bid::markAccepted).isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(bid::markRejected).isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(bid::markSuperseded).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void supersededBid_cannotBeWithdrawn() {
    var bid = BidFixtures.bid(UUID.randomUUID(), TENDER_ID, COMPANY_ID, "100", NOW);
    bid.markSuperseded();

    assertThatThrownBy(() -> bid.markWithdrawn("x", NOW))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void isOwnedBy_handlesNullCompany() {
    var bid = BidFixtures.bid(UUID.randomUUID(), TENDER_ID, COMPANY_ID, "100", NOW);

    assertThat(bid.isOwnedBy(COMPANY_ID)).isTrue();
    assertThat(bid.isOwnedBy(null)).isFalse();
    assertThat(bid.isOwnedBy(UUID.randomUUID())).isFalse();
  }
}
