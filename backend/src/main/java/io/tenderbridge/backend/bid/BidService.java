package io.tenderbridge.backend.bid;

import io.tenderbridge.backend.exception.ForbiddenException;
import io.tenderbridge.backend.exception.ResourceNotFoundException;
import io.tenderbridge.backend.security.Actor;
import io.tenderbridge.backend.tender.Tender;
import io.tenderbridge.backend.tender.TenderAccessPolicy;
import io.tenderbridge.backend.tender.TenderRepository;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Transactional entry point for bid operations. Loads the tender and bid, then delegates the rules
 * to {@link BidLedger}. The tender row is locked for writes so bids cannot slip in while the tender
 * is being closed or awarded.
 */
@Service
public class BidService {

  private final BidRepository bidRepository;
  private final TenderRepository tenderRepository;
  private final BidLedger bidLedger;
  private final TenderAccessPolicy accessPolicy;

  public BidService(
      BidRepository bidRepository,
      TenderRepository tenderRepository,
      BidLedger bidLedger,
      TenderAccessPolicy accessPolicy) {
    this.bidRepository = bidRepository;
    this.tenderRepository = tenderRepository;
    this.bidLedger = bidLedger;
    this.accessPolicy = accessPolicy;
  }

  @Transactional
  public Bid submitBid(UUID tenderId, Actor actor, BigDecimal amount, String documentRef) {
    var tender = lockTender(tenderId);
    return bidLedger.submitBid(tender, actor, amount, documentRef);
  }

  @Transactional
  public Bid withdrawBid(UUID bidId, Actor actor, String reason) {
    var bid = getBid(bidId);
    var tender = lockTender(bid.getTenderId());
    return bidLedger.withdrawBid(bid, tender, actor, reason);
  }

  @Transactional
  public Bid reviseBid(UUID bidId, Actor actor, BigDecimal newAmount, String newDocumentRef) {
    var bid = getBid(bidId);
    var tender = lockTender(bid.getTenderId());
    return bidLedger.reviseBid(bid, tender, actor, newAmount, newDocumentRef);
  }

  /** Tender administrators only; see {@link BidLedger#setShortlisted}. */
  @Transactional
  public Bid setShortlisted(UUID bidId, Actor actor, boolean shortlisted) {
    var bid = getBid(bidId);
    var tender = lockTender(bid.getTenderId());
    accessPolicy.requireCanAdminister(actor, tender);
    return bidLedger.setShortlisted(bid, tender, shortlisted);
  }

  /** Visible to the bidding company, the tender's administrators and admins. */
  @Transactional(readOnly = true)
  public Bid getBidFor(UUID bidId, Actor actor) {
    var bid = getBid(bidId);
    requireCanView(bid, actor);
    return bid;
  }

  @Transactional(readOnly = true)
  public List<Bid> listTenderBids(UUID tenderId, Actor actor) {
    var tender =
        tenderRepository
            .findById(tenderId)
            .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
    accessPolicy.requireCanAdminister(actor, tender);
    return bidRepository.findByTenderIdOrderBySubmittedAtAsc(tenderId);
  }

  @Transactional(readOnly = true)
  public List<Bid> listCompanyBids(UUID companyId, Actor actor) {
    if (!actor.isAdmin() && !companyId.equals(actor.companyId())) {
      throw new ForbiddenException("Not authorized", "Can only list bids of your own company");
    }
    return bidRepository.findByCompanyIdOrderBySubmittedAtDesc(companyId);
  }

  @Transactional(readOnly = true)
  public List<Bid> revisionHistory(UUID bidId, Actor actor) {
    var bid = getBid(bidId);
    requireCanView(bid, actor);
    return bidLedger.revisionHistory(bid);
  }

  private void requireCanView(Bid bid, Actor actor) {
    if (bid.isOwnedBy(actor.companyId()) || actor.isAdmin()) {
      return;
    }
    var tender = tenderRepository.findById(bid.getTenderId()).orElse(null);
    if (tender == null || !accessPolicy.canAdminister(actor, tender)) {
      throw new ForbiddenException("Not authorized", "Not authorized to view this bid");
    }
  }

  private Bid getBid(UUID bidId) {
    return bidRepository
        .findById(bidId)
        .orElseThrow(() -> new ResourceNotFoundException("Bid", bidId));
  }

  private Tender lockTender(UUID tenderId) {
    return tenderRepository
        .findByIdForUpdate(tenderId)
        .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
  }
}
