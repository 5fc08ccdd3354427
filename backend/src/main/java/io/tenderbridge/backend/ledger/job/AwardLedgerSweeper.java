package io.tenderbridge.backend.ledger.job;

import io.tenderbridge.backend.bid.BidRepository;
import io.tenderbridge.backend.exception.InvalidStateException;
import io.tenderbridge.backend.exception.ResourceNotFoundException;
import io.tenderbridge.backend.tender.TenderRepository;
import io.tenderbridge.backend.tender.TenderStatus;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Enqueues ledger commits for awarded tenders that have neither proof nor a job. */
@Component
public class AwardLedgerSweeper {

  private static final Logger log = LoggerFactory.getLogger(AwardLedgerSweeper.class);

  private final TenderRepository tenderRepository;
  private final BidRepository bidRepository;
  private final AwardJobQueue jobQueue;

  public AwardLedgerSweeper(
      TenderRepository tenderRepository, BidRepository bidRepository, AwardJobQueue jobQueue) {
    this.tenderRepository = tenderRepository;
    this.bidRepository = bidRepository;
    this.jobQueue = jobQueue;
  }

  @Scheduled(fixedDelayString = "${tenderbridge.ledger.sweep-interval:900000}")
  public void scheduledSweep() {
    sweep();
  }

  public int sweep() {
    var orphaned = tenderRepository.findAwardedIdsWithoutLedgerJob();
    int enqueued = 0;
    for (var tenderId : orphaned) {
      try {
        enqueueForTender(tenderId);
        enqueued++;
      } catch (Exception e) {
        log.error("Sweeper failed to enqueue ledger commit for tender {}", tenderId, e);
      }
    }
    if (enqueued > 0) {
      log.info("Award ledger sweeper enqueued {} missed commit(s)", enqueued);
    }
    return enqueued;
  }

  /** Enqueues (or returns the existing) ledger commit job of an awarded tender. */
  @Transactional(readOnly = true)
  public LedgerJob enqueueForTender(UUID tenderId) {
    var tender =
        tenderRepository
            .findById(tenderId)
            .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
    if (tender.getStatus() != TenderStatus.AWARDED) {
      throw new InvalidStateException(
          "Invalid tender state",
          "Tender is '%s'. Only awarded tenders are committed to the ledger."
              .formatted(tender.getStatus().value()));
    }
    var bid =
        bidRepository
            .findById(tender.getWinningBidId())
            .orElseThrow(() -> new ResourceNotFoundException("Bid", tender.getWinningBidId()));
    return jobQueue.enqueue(
        AwardJobQueue.AWARD_COMMIT_JOB,
        new AwardCommitPayload(tenderId, bid.getId(), bid.getAmount()));
  }
}
