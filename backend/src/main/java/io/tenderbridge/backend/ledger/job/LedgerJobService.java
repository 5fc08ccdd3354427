package io.tenderbridge.backend.ledger.job;

import io.tenderbridge.backend.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Operator view of the award commit queue. */
@Service
public class LedgerJobService {

  private static final Logger log = LoggerFactory.getLogger(LedgerJobService.class);

  private final LedgerJobRepository jobRepository;
  private final Clock clock;

  public LedgerJobService(LedgerJobRepository jobRepository, Clock clock) {
    this.jobRepository = jobRepository;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public Page<LedgerJob> listJobs(LedgerJobStatus status, Pageable pageable) {
    return jobRepository.findFiltered(status, pageable);
  }

  @Transactional(readOnly = true)
  public List<LedgerJob> jobsForTender(UUID tenderId) {
    return jobRepository.findByTenderIdOrderByCreatedAtDesc(tenderId);
  }

  /** Moves a FAILED job back to ENQUEUED with its attempt counter reset. */
  @Transactional
  public LedgerJob requeue(UUID jobId) {
    var job =
        jobRepository
            .findByIdForUpdate(jobId)
            .orElseThrow(() -> new ResourceNotFoundException("Ledger job", jobId));
    job.requeue(Instant.now(clock));
    log.info("Requeued failed ledger job {} for tender {}", jobId, job.getTenderId());
    return jobRepository.save(job);
  }
}
