package io.tenderbridge.backend.ledger.job;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** {@link AwardJobQueue} backed by the {@code ledger_jobs} table. */
@Component
public class DatabaseAwardJobQueue implements AwardJobQueue {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAwardJobQueue.class);

  private static final EnumSet<LedgerJobStatus> LIVE_STATUSES =
      EnumSet.of(LedgerJobStatus.ENQUEUED, LedgerJobStatus.RUNNING, LedgerJobStatus.COMMITTED);

  private final LedgerJobRepository jobRepository;
  private final Clock clock;

  public DatabaseAwardJobQueue(LedgerJobRepository jobRepository, Clock clock) {
    this.jobRepository = jobRepository;
    this.clock = clock;
  }

  /** Runs in its own transaction; callers are usually after-commit listeners. */
  @Override
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public LedgerJob enqueue(String jobName, AwardCommitPayload payload) {
    var existing =
        jobRepository.findFirstByTenderIdAndStatusInOrderByCreatedAtDesc(
            payload.tenderId(), LIVE_STATUSES);
    if (existing.isPresent()) {
      log.debug(
          "Ledger job {} already {} for tender {}",
          existing.get().getId(),
          existing.get().getStatus().value(),
          payload.tenderId());
      return existing.get();
    }

    var job = jobRepository.save(new LedgerJob(jobName, payload, Instant.now(clock)));
    log.info("Enqueued {} job {} for tender {}", jobName, job.getId(), payload.tenderId());
    return job;
  }
}
