package io.tenderbridge.backend.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published inside the award transaction. Post-commit listeners use it to enqueue the ledger
 * commit job and to notify bidders.
 */
public record TenderAwardedEvent(
    UUID tenderId,
    String tenderTitle,
    UUID ownerCompanyId,
    UUID winningBidId,
    UUID winningCompanyId,
    BigDecimal awardAmount,
    UUID actorId,
    Instant occurredAt)
    implements TenderDomainEvent {

  @Override
  public String eventType() {
    return "tender_awarded";
  }
}
