package io.tenderbridge.backend.ledger.job;

import io.tenderbridge.backend.ledger.LedgerProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Polls {@code ledger_jobs} for due commits and hands them to {@link AwardJobWorker}. Jobs are
 * claimed (ENQUEUED to RUNNING) in a short transaction, run outside any transaction, and their
 * outcome is written in a second one. Failed attempts are retried with exponential backoff until
 * {@code max-attempts} is reached, after which the job stays FAILED for an admin to requeue.
 */
@Component
public class AwardJobRunner {

  private static final Logger log = LoggerFactory.getLogger(AwardJobRunner.class);

  private final LedgerJobRepository jobRepository;
  private final AwardJobWorker worker;
  private final TransactionTemplate transactionTemplate;
  private final LedgerProperties.Jobs settings;
  private final Clock clock;

  public AwardJobRunner(
      LedgerJobRepository jobRepository,
      AwardJobWorker worker,
      TransactionTemplate transactionTemplate,
      LedgerProperties properties,
      Clock clock) {
    this.jobRepository = jobRepository;
    this.worker = worker;
    this.transactionTemplate = transactionTemplate;
    this.settings = properties.jobs();
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${tenderbridge.ledger.jobs.poll-interval:5000}")
  public void poll() {
    try {
      recoverStaleJobs();
      runDueJobs();
    } catch (Exception e) {
      log.error("Award job poll failed", e);
    }
  }

  /** Claims and runs one batch of due jobs. Returns the number of jobs that committed. */
  public int runDueJobs() {
    List<UUID> claimed = transactionTemplate.execute(status -> claimBatch());
    if (claimed == null || claimed.isEmpty()) {
      return 0;
    }

    int committed = 0;
    for (var jobId : claimed) {
      try {
        if (runClaimed(jobId)) {
          committed++;
        }
      } catch (Exception e) {
        log.error(
            "Ledger job {} could not be finished; it is recovered after the running timeout",
            jobId,
            e);
      }
    }
    log.info("Award job runner processed {} job(s), {} committed", claimed.size(), committed);
    return committed;
  }

  /** RUNNING jobs older than the running timeout are returned to the queue. */
  public int recoverStaleJobs() {
    Integer recovered =
        transactionTemplate.execute(
            status -> {
              var now = Instant.now(clock);
              var stale =
                  jobRepository.findStaleRunningForUpdate(now.minus(settings.runningTimeout()));
              for (var job : stale) {
                log.warn(
                    "Ledger job {} for tender {} timed out while running; requeueing",
                    job.getId(),
                    job.getTenderId());
                job.recoverStale(now);
              }
              jobRepository.saveAll(stale);
              return stale.size();
            });
    return recovered != null ? recovered : 0;
  }

  private List<UUID> claimBatch() {
    var now = Instant.now(clock);
    var due = jobRepository.findDueForUpdate(now, PageRequest.of(0, settings.batchSize()));
    for (var job : due) {
      job.markRunning(now);
    }
    jobRepository.saveAll(due);
    return due.stream().map(LedgerJob::getId).toList();
  }

  private boolean runClaimed(UUID jobId) {
    var job = jobRepository.findById(jobId).orElse(null);
    if (job == null) {
      return false;
    }
    try {
      var outcome = worker.commitAward(job.payload());
      return finish(
          jobId, j -> j.markCommitted(outcome.contentHash(), outcome.commitRef(), now()));
    } catch (AwardJobException e) {
      log.error(
          "Ledger job {} for tender {} failed permanently: {}",
          jobId,
          job.getTenderId(),
          e.getMessage());
      finish(jobId, j -> j.markFailed(e.getMessage(), now()));
    } catch (Exception e) {
      if (job.getAttempts() >= settings.maxAttempts()) {
        log.error(
            "Ledger job {} for tender {} failed after {} attempts; giving up",
            jobId,
            job.getTenderId(),
            job.getAttempts(),
            e);
        finish(jobId, j -> j.markFailed(describe(e), now()));
      } else {
        var retryAt = now().plus(settings.backoffFor(job.getAttempts()));
        log.warn(
            "Ledger job {} for tender {} failed (attempt {}/{}), retrying at {}: {}",
            jobId,
            job.getTenderId(),
            job.getAttempts(),
            settings.maxAttempts(),
            retryAt,
            describe(e));
        finish(jobId, j -> j.scheduleRetry(describe(e), retryAt));
      }
    }
    return false;
  }

  /**
   * Applies {@code update} to the job if it is still RUNNING. A job that was requeued by {@link
   * #recoverStaleJobs()} while its worker ran belongs to the next claimer, so this attempt's
   * outcome is dropped; the worker is idempotent and the next run reconciles it.
   */
  private boolean finish(UUID jobId, Consumer<LedgerJob> update) {
    Boolean applied =
        transactionTemplate.execute(
            status -> {
              var job = jobRepository.findByIdForUpdate(jobId).orElse(null);
              if (job == null) {
                return false;
              }
              if (job.getStatus() != LedgerJobStatus.RUNNING) {
                log.warn(
                    "Ledger job {} for tender {} is {} rather than running; dropping this outcome",
                    jobId,
                    job.getTenderId(),
                    job.getStatus().value());
                return false;
              }
              update.accept(job);
              jobRepository.save(job);
              return true;
            });
    return Boolean.TRUE.equals(applied);
  }

  private Instant now() {
    return Instant.now(clock);
  }

  private static String describe(Exception e) {
    return e.getClass().getSimpleName() + ": " + e.getMessage();
  }
}
