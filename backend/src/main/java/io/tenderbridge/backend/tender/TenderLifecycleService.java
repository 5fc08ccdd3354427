package io.tenderbridge.backend.tender;

import io.tenderbridge.backend.bid.BidLedger;
import io.tenderbridge.backend.event.TenderAwardedEvent;
import io.tenderbridge.backend.event.TenderStatusChangedEvent;
import io.tenderbridge.backend.exception.EmptyJustificationException;
import io.tenderbridge.backend.exception.InvalidStateException;
import io.tenderbridge.backend.exception.InvalidTransitionException;
import io.tenderbridge.backend.exception.ResourceNotFoundException;
import io.tenderbridge.backend.security.Actor;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The only writer of {@link Tender#getStatus()}. Every method loads the tender with a row lock and
 * runs in one transaction, so a status change and its bid resolution commit or roll back together.
 *
 * <p>Authorization is the caller's job ({@link TenderAccessPolicy}); the scheduler calls in with
 * {@link Actor#system()}.
 */
@Service
public class TenderLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(TenderLifecycleService.class);

  private final TenderRepository tenderRepository;
  private final BidLedger bidLedger;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public TenderLifecycleService(
      TenderRepository tenderRepository,
      BidLedger bidLedger,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.tenderRepository = tenderRepository;
    this.bidLedger = bidLedger;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Moves a tender to {@code newStatus}. A request for the current status returns the tender
   * untouched and publishes nothing. AWARDED is only reachable through {@link #award}.
   */
  @Transactional
  public Tender changeStatus(UUID tenderId, TenderStatus newStatus, String reason, Actor actor) {
    var tender = loadForUpdate(tenderId);
    var oldStatus = tender.getStatus();

    if (newStatus == TenderStatus.AWARDED && oldStatus != TenderStatus.AWARDED) {
      throw new InvalidStateException(
          "Award requires a winning bid",
          "Tenders are awarded through the award operation, which names the winning bid");
    }

    var result = TenderStateMachine.validateTransition(oldStatus, newStatus, reason);
    if (!result.valid()) {
      throw new InvalidTransitionException(
          result.message(), TenderStateMachine.allowedValues(oldStatus));
    }
    if (result.unchanged()) {
      return tender;
    }

    var now = now();
    if (newStatus == TenderStatus.CANCELLED) {
      tender.markCancelled(reason.trim(), actor.userId(), now);
    } else {
      tender.applyStatus(newStatus, now);
    }
    tender = tenderRepository.save(tender);

    eventPublisher.publishEvent(
        new TenderStatusChangedEvent(
            tender.getId(),
            tender.getTitle(),
            tender.getOwnerCompanyId(),
            oldStatus.value(),
            newStatus.value(),
            actor.userId(),
            actor.actorType(),
            reason,
            now));
    log.info(
        "Tender {} moved {} -> {} by {}",
        tenderId,
        oldStatus.value(),
        newStatus.value(),
        actor.isSystem() ? "system" : actor.userId());
    return tender;
  }

  /** Shortcut for OPEN to CLOSED. */
  @Transactional
  public Tender close(UUID tenderId, Actor actor) {
    var tender = loadForUpdate(tenderId);
    if (tender.getStatus() != TenderStatus.OPEN) {
      throw new InvalidStateException(
          "Invalid tender state",
          "Tender is '%s'. Only 'open' tenders can be closed."
              .formatted(tender.getStatus().value()));
    }
    return changeStatus(tenderId, TenderStatus.CLOSED, null, actor);
  }

  /**
   * Names the winning bid, accepts it, rejects every other live bid and marks the tender AWARDED,
   * all in one transaction. The ledger commit is enqueued by a listener after this transaction
   * commits and never affects its outcome.
   */
  @Transactional
  public Tender award(UUID tenderId, UUID winningBidId, String justification, Actor actor) {
    var tender = loadForUpdate(tenderId);

    if (tender.getStatus() == TenderStatus.AWARDED) {
      throw new InvalidStateException("Invalid tender state", "Tender is already awarded");
    }
    if (!TenderStateMachine.canAward(tender.getStatus())) {
      throw new InvalidStateException(
          "Invalid tender state",
          "Tender is '%s'. Only tenders in 'evaluation' can be awarded."
              .formatted(tender.getStatus().value()));
    }
    if (justification == null || justification.isBlank()) {
      throw new EmptyJustificationException();
    }

    var winner = bidLedger.resolveAward(tender, winningBidId);

    var oldStatus = tender.getStatus();
    var now = now();
    tender.markAwarded(winner.getId(), justification.trim(), actor.userId(), now);
    tender = tenderRepository.save(tender);

    eventPublisher.publishEvent(
        new TenderStatusChangedEvent(
            tender.getId(),
            tender.getTitle(),
            tender.getOwnerCompanyId(),
            oldStatus.value(),
            TenderStatus.AWARDED.value(),
            actor.userId(),
            actor.actorType(),
            null,
            now));
    eventPublisher.publishEvent(
        new TenderAwardedEvent(
            tender.getId(),
            tender.getTitle(),
            tender.getOwnerCompanyId(),
            winner.getId(),
            winner.getCompanyId(),
            winner.getAmount(),
            actor.userId(),
            now));
    log.info(
        "Tender {} awarded to bid {} (company {})",
        tenderId,
        winner.getId(),
        winner.getCompanyId());
    return tender;
  }

  private Tender loadForUpdate(UUID tenderId) {
    return tenderRepository
        .findByIdForUpdate(tenderId)
        .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
  }

  private Instant now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
  }
}
