package io.tenderbridge.backend.ledger.job;

import io.tenderbridge.backend.bid.Bid;
import io.tenderbridge.backend.bid.BidLedger;
import io.tenderbridge.backend.bid.BidRepository;
import io.tenderbridge.backend.ledger.AwardLedgerClient;
import io.tenderbridge.backend.ledger.AwardLedgerEntry;
import io.tenderbridge.backend.ledger.AwardPayloadHasher;
import io.tenderbridge.backend.ledger.LedgerCommitReceipt;
import io.tenderbridge.backend.tender.Tender;
import io.tenderbridge.backend.tender.TenderRepository;
import io.tenderbridge.backend.tender.TenderStatus;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Commits one award to the ledger and writes the proof back onto the tender.
 *
 * <p>Safe to run more than once for the same tender: the hash is derived only from persisted award
 * facts, and an award already on the ledger with the same hash is adopted instead of written again.
 * No database transaction is held open while the ledger is called.
 */
@Component
public class AwardJobWorker {

  private static final Logger log = LoggerFactory.getLogger(AwardJobWorker.class);

  private final TenderRepository tenderRepository;
  private final BidRepository bidRepository;
  private final BidLedger bidLedger;
  private final AwardLedgerClient ledgerClient;
  private final AwardPayloadHasher hasher;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public AwardJobWorker(
      TenderRepository tenderRepository,
      BidRepository bidRepository,
      BidLedger bidLedger,
      AwardLedgerClient ledgerClient,
      AwardPayloadHasher hasher,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.tenderRepository = tenderRepository;
    this.bidRepository = bidRepository;
    this.bidLedger = bidLedger;
    this.ledgerClient = ledgerClient;
    this.hasher = hasher;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  /**
   * @throws AwardJobException if the award can never be committed (missing or changed records)
   * @throws io.tenderbridge.backend.exception.LedgerUnavailableException if the ledger call failed
   *     and may be retried
   */
  public AwardCommitOutcome commitAward(AwardCommitPayload payload) {
    var snapshot = transactionTemplate.execute(status -> loadAward(payload));
    var tender = snapshot.tender();
    var facts = hasher.factsFor(tender, snapshot.winningBid());
    var contentHash = hasher.contentHash(facts);

    if (contentHash.equals(tender.getLedgerContentHash()) && tender.getLedgerCommitRef() != null) {
      log.info("Tender {} already carries ledger proof {}", tender.getId(), contentHash);
      return new AwardCommitOutcome(contentHash, tender.getLedgerCommitRef(), false);
    }

    var onLedger = ledgerClient.getAward(facts.tenderId());
    LedgerCommitReceipt receipt;
    boolean submitted;
    if (onLedger.isPresent()) {
      if (!contentHash.equals(onLedger.get().contentHash())) {
        throw new AwardJobException(
            "Ledger already holds a different award for tender %s (ledger %s, computed %s)"
                .formatted(tender.getId(), onLedger.get().contentHash(), contentHash));
      }
      log.info("Award for tender {} is already on the ledger; adopting it", tender.getId());
      receipt =
          new LedgerCommitReceipt(
              contentHash, onLedger.get().commitRef(), onLedger.get().blockNumber());
      submitted = false;
    } else {
      receipt =
          ledgerClient.recordAward(
              new AwardLedgerEntry(
                  facts.tenderId(),
                  facts.winningBidId(),
                  facts.winningCompanyId(),
                  facts.awardAmount(),
                  contentHash));
      submitted = true;
    }

    transactionTemplate.executeWithoutResult(
        status -> {
          var locked =
              tenderRepository
                  .findByIdForUpdate(payload.tenderId())
                  .orElseThrow(
                      () -> new AwardJobException("Tender " + payload.tenderId() + " vanished"));
          locked.recordLedgerCommit(contentHash, receipt.commitRef(), Instant.now(clock));
          tenderRepository.save(locked);
          bidRepository.findById(payload.winningBidId()).ifPresent(bidLedger::confirmAccepted);
        });

    log.info(
        "Committed award of tender {} to {} ledger: hash={}, ref={}",
        tender.getId(),
        ledgerClient.providerId(),
        contentHash,
        receipt.commitRef());
    return new AwardCommitOutcome(contentHash, receipt.commitRef(), submitted);
  }

  private AwardSnapshot loadAward(AwardCommitPayload payload) {
    var tender =
        tenderRepository
            .findById(payload.tenderId())
            .orElseThrow(
                () -> new AwardJobException("Tender " + payload.tenderId() + " not found"));
    if (tender.getStatus() != TenderStatus.AWARDED) {
      throw new AwardJobException(
          "Tender %s is '%s', not awarded"
              .formatted(tender.getId(), tender.getStatus().value()));
    }
    if (!payload.winningBidId().equals(tender.getWinningBidId())) {
      throw new AwardJobException(
          "Job names bid %s but tender %s was awarded to %s"
              .formatted(payload.winningBidId(), tender.getId(), tender.getWinningBidId()));
    }
    var bid =
        bidRepository
            .findById(payload.winningBidId())
            .orElseThrow(
                () -> new AwardJobException("Bid " + payload.winningBidId() + " not found"));
    return new AwardSnapshot(tender, bid);
  }

  private record AwardSnapshot(Tender tender, Bid winningBid) {}
}
