package io.tenderbridge.backend.ledger.job;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/** Arguments of an award ledger commit job. */
public record AwardCommitPayload(UUID tenderId, UUID winningBidId, BigDecimal awardAmount) {

  public AwardCommitPayload {
    Objects.requireNonNull(tenderId, "tenderId must not be null");
    Objects.requireNonNull(winningBidId, "winningBidId must not be null");
    Objects.requireNonNull(awardAmount, "awardAmount must not be null");
  }
}
