package io.tenderbridge.backend.bid;

import io.tenderbridge.backend.event.BidRevisedEvent;
import io.tenderbridge.backend.event.BidSubmittedEvent;
import io.tenderbridge.backend.event.BidWithdrawnEvent;
import io.tenderbridge.backend.exception.BidAlreadyWithdrawnException;
import io.tenderbridge.backend.exception.ForbiddenException;
import io.tenderbridge.backend.exception.InvalidBidException;
import io.tenderbridge.backend.exception.InvalidStateException;
import io.tenderbridge.backend.exception.ResourceNotFoundException;
import io.tenderbridge.backend.exception.SelfBiddingException;
import io.tenderbridge.backend.exception.UnassignedActorException;
import io.tenderbridge.backend.security.Actor;
import io.tenderbridge.backend.tender.Tender;
import io.tenderbridge.backend.tender.TenderStateMachine;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Rules for the bids of a tender: submission gating, withdrawal, revision chains and the one-pass
 * resolution of every bid when the tender is awarded.
 *
 * <p>Callers pass in the already-loaded {@link Tender} and run each method inside their own
 * transaction; the ledger itself never changes tender state.
 */
@Component
public class BidLedger {

  private static final Logger log = LoggerFactory.getLogger(BidLedger.class);

  private final BidRepository bidRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public BidLedger(
      BidRepository bidRepository, ApplicationEventPublisher eventPublisher, Clock clock) {
    this.bidRepository = bidRepository;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  public Bid submitBid(Tender tender, Actor actor, BigDecimal amount, String documentRef) {
    Objects.requireNonNull(amount, "amount must not be null");
    if (!actor.hasCompany()) {
      throw new UnassignedActorException("submit a bid");
    }
    var now = now();
    requireBiddingWindow(tender, now, "submit bids");
    if (tender.getOwnerCompanyId().equals(actor.companyId())) {
      throw new SelfBiddingException(tender.getId());
    }

    var bid =
        bidRepository.save(
            new Bid(tender.getId(), actor.companyId(), actor.userId(), amount, documentRef, now));

    eventPublisher.publishEvent(
        new BidSubmittedEvent(
            bid.getId(), tender.getId(), bid.getCompanyId(), amount, actor.userId(), now));
    log.info(
        "Bid {} submitted on tender {} by company {}",
        bid.getId(),
        tender.getId(),
        bid.getCompanyId());
    return bid;
  }

  public Bid withdrawBid(Bid bid, Tender tender, Actor actor, String reason) {
    requireOwner(bid, actor, "withdraw");
    if (bid.isWithdrawn()) {
      throw new BidAlreadyWithdrawnException(bid.getId());
    }
    var now = now();
    requireBiddingWindow(tender, now, "withdraw bids");

    bid.markWithdrawn(reason, now);
    var saved = bidRepository.save(bid);

    eventPublisher.publishEvent(
        new BidWithdrawnEvent(
            saved.getId(), tender.getId(), saved.getCompanyId(), reason, actor.userId(), now));
    log.info("Bid {} withdrawn from tender {}", saved.getId(), tender.getId());
    return saved;
  }

  /**
   * Replaces {@code original} with a new revision. The original becomes SUPERSEDED and the new row
   * points back to it with {@code revisionNumber + 1}.
   */
  public Bid reviseBid(
      Bid original, Tender tender, Actor actor, BigDecimal newAmount, String newDocumentRef) {
    Objects.requireNonNull(newAmount, "newAmount must not be null");
    requireOwner(original, actor, "revise");
    if (original.isWithdrawn()) {
      throw new InvalidStateException("Invalid bid state", "Cannot revise a withdrawn bid");
    }
    if (original.isSuperseded()) {
      throw new InvalidStateException(
          "Invalid bid state",
          "Bid " + original.getId() + " has already been revised; revise the latest revision");
    }
    var now = now();
    requireBiddingWindow(tender, now, "revise bids");

    original.markSuperseded();
    bidRepository.save(original);
    var revised =
        bidRepository.save(original.nextRevision(actor.userId(), newAmount, newDocumentRef, now));

    eventPublisher.publishEvent(
        new BidRevisedEvent(
            revised.getId(),
            original.getId(),
            tender.getId(),
            revised.getCompanyId(),
            newAmount,
            revised.getRevisionNumber(),
            actor.userId(),
            now));
    log.info(
        "Bid {} revised as {} (revision {})",
        original.getId(),
        revised.getId(),
        revised.getRevisionNumber());
    return revised;
  }

  /**
   * Accepts the named bid and rejects every other bid of the tender that is not withdrawn.
   * Withdrawn bids are left untouched. All checks run before any bid is modified.
   *
   * @return the accepted bid
   */
  public Bid resolveAward(Tender tender, UUID winningBidId) {
    var bids = bidRepository.findByTenderIdOrderBySubmittedAtAsc(tender.getId());
    var winner =
        bids.stream()
            .filter(b -> b.getId().equals(winningBidId))
            .findFirst()
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Bid not found",
                        "No bid " + winningBidId + " found for tender " + tender.getId()));
    if (winner.isWithdrawn()) {
      throw new InvalidBidException("Cannot award to a withdrawn bid");
    }

    var changed = new ArrayList<Bid>(bids.size());
    for (var bid : bids) {
      if (bid == winner) {
        bid.markAccepted();
        changed.add(bid);
      } else if (!bid.isWithdrawn()) {
        bid.markRejected();
        changed.add(bid);
      }
    }
    bidRepository.saveAll(changed);

    log.info(
        "Resolved {} bid(s) on tender {}: winner={}",
        changed.size(),
        tender.getId(),
        winner.getId());
    return winner;
  }

  /**
   * Moves a pending bid onto the shortlist, or a shortlisted one back to pending, while the tender
   * owner evaluates. Accepting and rejecting happen only through {@link #resolveAward}.
   */
  public Bid setShortlisted(Bid bid, Tender tender, boolean shortlisted) {
    if (!TenderStateMachine.canEvaluateBids(tender.getStatus())) {
      throw new InvalidStateException(
          "Tender not under evaluation",
          "Tender is '%s'. Bids can only be shortlisted while it is 'closed' or 'evaluation'."
              .formatted(tender.getStatus().value()));
    }
    var target = shortlisted ? BidStatus.SHORTLISTED : BidStatus.PENDING;
    if (bid.getStatus() == target) {
      return bid;
    }
    if (shortlisted) {
      bid.markShortlisted();
    } else {
      bid.clearShortlist();
    }
    var saved = bidRepository.save(bid);
    log.info("Bid {} on tender {} is now {}", saved.getId(), tender.getId(), target.value());
    return saved;
  }

  /** Re-asserts ACCEPTED on an award's winning bid. A no-op when it is already accepted. */
  public void confirmAccepted(Bid winningBid) {
    if (winningBid.getStatus() == BidStatus.ACCEPTED) {
      return;
    }
    winningBid.markAccepted();
    bidRepository.save(winningBid);
    log.warn("Winning bid {} was not accepted; restored ACCEPTED", winningBid.getId());
  }

  /**
   * Returns the revision chain ending at {@code bid}, oldest first. Each revision only knows its
   * immediate parent, so the chain is walked one link at a time.
   */
  public List<Bid> revisionHistory(Bid bid) {
    var chain = new ArrayList<Bid>();
    var seen = new HashSet<UUID>();
    var current = bid;
    while (current != null) {
      if (!seen.add(current.getId())) {
        throw new IllegalStateException("Revision chain of bid " + bid.getId() + " has a cycle");
      }
      chain.add(0, current);
      var parentId = current.getParentBidId();
      current = parentId == null ? null : bidRepository.findById(parentId).orElse(null);
    }
    return chain;
  }

  private void requireOwner(Bid bid, Actor actor, String action) {
    if (!bid.isOwnedBy(actor.companyId())) {
      throw new ForbiddenException("Not authorized", "Not authorized to " + action + " this bid");
    }
  }

  private void requireBiddingWindow(Tender tender, Instant now, String action) {
    if (tender.isAcceptingBidsAt(now)) {
      return;
    }
    if (!tender.canReceiveBids()) {
      throw new InvalidStateException(
          "Tender not accepting bids",
          "Tender is '%s'. Cannot %s unless the tender is 'open'."
              .formatted(tender.getStatus().value(), action));
    }
    throw new InvalidStateException(
        "Tender not accepting bids", "Tender has passed its closing date. Cannot " + action + ".");
  }

  private Instant now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
  }
}
