package io.tenderbridge.backend.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record BidSubmittedEvent(
    UUID bidId,
    UUID tenderId,
    UUID companyId,
    BigDecimal amount,
    UUID actorId,
    Instant occurredAt)
    implements TenderDomainEvent {

  @Override
  public String eventType() {
    return "bid_submitted";
  }
}
