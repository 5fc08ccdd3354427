package io.tenderbridge.backend.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record BidRevisedEvent(
    UUID bidId,
    UUID previousBidId,
    UUID tenderId,
    UUID companyId,
    BigDecimal amount,
    int revisionNumber,
    UUID actorId,
    Instant occurredAt)
    implements TenderDomainEvent {

  @Override
  public String eventType() {
    return "bid_revised";
  }
}
