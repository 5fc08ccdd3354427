package io.tenderbridge.backend.ledger.job;

import io.tenderbridge.backend.event.TenderAwardedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Enqueues the ledger commit once an award transaction has committed. A failed enqueue is logged
 * and left to {@link AwardLedgerSweeper}; the award itself stands.
 */
@Component
public class AwardLedgerEnqueueListener {

  private static final Logger log = LoggerFactory.getLogger(AwardLedgerEnqueueListener.class);

  private final AwardJobQueue jobQueue;

  public AwardLedgerEnqueueListener(AwardJobQueue jobQueue) {
    this.jobQueue = jobQueue;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onTenderAwarded(TenderAwardedEvent event) {
    try {
      jobQueue.enqueue(
          AwardJobQueue.AWARD_COMMIT_JOB,
          new AwardCommitPayload(event.tenderId(), event.winningBidId(), event.awardAmount()));
    } catch (Exception e) {
      log.error(
          "Failed to enqueue ledger commit for awarded tender {}; the sweeper will retry",
          event.tenderId(),
          e);
    }
  }
}
