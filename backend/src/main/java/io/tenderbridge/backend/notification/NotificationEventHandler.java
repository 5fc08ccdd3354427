package io.tenderbridge.backend.notification;

import io.tenderbridge.backend.event.BidRevisedEvent;
import io.tenderbridge.backend.event.BidSubmittedEvent;
import io.tenderbridge.backend.event.BidWithdrawnEvent;
import io.tenderbridge.backend.event.QuestionAnsweredEvent;
import io.tenderbridge.backend.event.QuestionAskedEvent;
import io.tenderbridge.backend.event.TenderAwardedEvent;
import io.tenderbridge.backend.event.TenderDomainEvent;
import io.tenderbridge.backend.event.TenderStatusChangedEvent;
import io.tenderbridge.backend.notification.channel.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Turns committed domain events into {@link TenderNotice}s. Runs AFTER_COMMIT, so rolled-back
 * changes never notify anyone and a notification failure never touches the domain transaction.
 */
@Component
public class NotificationEventHandler {

  private static final Logger log = LoggerFactory.getLogger(NotificationEventHandler.class);

  private final NotificationDispatcher dispatcher;

  public NotificationEventHandler(NotificationDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onDomainEvent(TenderDomainEvent event) {
    try {
      dispatcher.dispatch(toNotice(event));
    } catch (Exception e) {
      log.warn(
          "Failed to create notice for event={} tender={}",
          event.eventType(),
          event.tenderId(),
          e);
    }
  }

  static TenderNotice toNotice(TenderDomainEvent event) {
    if (event instanceof TenderStatusChangedEvent e) {
      var title =
          "Tender \"%s\" moved from %s to %s"
              .formatted(e.tenderTitle(), e.oldStatus(), e.newStatus());
      return new TenderNotice(
          e.eventType(), e.tenderId(), e.ownerCompanyId(), title, e.occurredAt());
    }
    if (event instanceof TenderAwardedEvent e) {
      return new TenderNotice(
          e.eventType(),
          e.tenderId(),
          e.winningCompanyId(),
          "Your bid won tender \"%s\"".formatted(e.tenderTitle()),
          e.occurredAt());
    }
    if (event instanceof BidSubmittedEvent e) {
      return new TenderNotice(
          e.eventType(), e.tenderId(), e.companyId(), "Bid submitted", e.occurredAt());
    }
    if (event instanceof BidWithdrawnEvent e) {
      return new TenderNotice(
          e.eventType(), e.tenderId(), e.companyId(), "Bid withdrawn", e.occurredAt());
    }
    if (event instanceof BidRevisedEvent e) {
      return new TenderNotice(
          e.eventType(),
          e.tenderId(),
          e.companyId(),
          "Bid revised (revision %d)".formatted(e.revisionNumber()),
          e.occurredAt());
    }
    if (event instanceof QuestionAskedEvent e) {
      return new TenderNotice(
          e.eventType(),
          e.tenderId(),
          e.ownerCompanyId(),
          "New question on tender \"%s\"".formatted(e.tenderTitle()),
          e.occurredAt());
    }
    if (event instanceof QuestionAnsweredEvent e) {
      return new TenderNotice(
          e.eventType(),
          e.tenderId(),
          e.askedByCompanyId(),
          e.askedById(),
          "Your question on tender \"%s\" was answered".formatted(e.tenderTitle()),
          e.occurredAt());
    }
    throw new IllegalArgumentException("Unhandled event type " + event.eventType());
  }
}
