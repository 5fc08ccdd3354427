package io.tenderbridge.backend.admin;

import io.tenderbridge.backend.exception.InvalidStateException;
import io.tenderbridge.backend.ledger.job.AwardLedgerSweeper;
import io.tenderbridge.backend.ledger.job.LedgerJob;
import io.tenderbridge.backend.ledger.job.LedgerJobService;
import io.tenderbridge.backend.ledger.job.LedgerJobStatus;
import io.tenderbridge.backend.tender.TenderStatusScheduler;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Operator endpoints for the award ledger queue and the scheduled transitions. */
@RestController
@PreAuthorize("hasRole('ADMIN')")
public class AdminController {

  private final LedgerJobService jobService;
  private final AwardLedgerSweeper sweeper;
  private final TenderStatusScheduler statusScheduler;

  public AdminController(
      LedgerJobService jobService,
      AwardLedgerSweeper sweeper,
      TenderStatusScheduler statusScheduler) {
    this.jobService = jobService;
    this.sweeper = sweeper;
    this.statusScheduler = statusScheduler;
  }

  @GetMapping("/api/admin/ledger-jobs")
  public ResponseEntity<Page<LedgerJobResponse>> listJobs(
      @RequestParam(required = false) String status, Pageable pageable) {
    var page = jobService.listJobs(status != null ? parseStatus(status) : null, pageable);
    return ResponseEntity.ok(page.map(LedgerJobResponse::from));
  }

  @PostMapping("/api/admin/ledger-jobs/{id}/requeue")
  public ResponseEntity<LedgerJobResponse> requeueJob(@PathVariable UUID id) {
    return ResponseEntity.ok(LedgerJobResponse.from(jobService.requeue(id)));
  }

  @PostMapping("/api/admin/tenders/{id}/ledger-commit")
  public ResponseEntity<LedgerJobResponse> enqueueLedgerCommit(@PathVariable UUID id) {
    return ResponseEntity.accepted().body(LedgerJobResponse.from(sweeper.enqueueForTender(id)));
  }

  @PostMapping("/api/admin/jobs/status-transitions/run")
  public ResponseEntity<TenderStatusScheduler.TransitionSummary> runStatusTransitions() {
    return ResponseEntity.ok(statusScheduler.runTransitions());
  }

  private static LedgerJobStatus parseStatus(String value) {
    try {
      return LedgerJobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException(
          "Invalid status", "Unknown ledger job status '" + value + "'");
    }
  }

  public record LedgerJobResponse(
      UUID id,
      String jobName,
      UUID tenderId,
      UUID winningBidId,
      String status,
      int attempts,
      Instant nextAttemptAt,
      String lastError,
      String contentHash,
      String commitRef,
      Instant createdAt,
      Instant finishedAt) {

    public static LedgerJobResponse from(LedgerJob job) {
      return new LedgerJobResponse(
          job.getId(),
          job.getJobName(),
          job.getTenderId(),
          job.getWinningBidId(),
          job.getStatus().value(),
          job.getAttempts(),
          job.getNextAttemptAt(),
          job.getLastError(),
          job.getContentHash(),
          job.getCommitRef(),
          job.getCreatedAt(),
          job.getFinishedAt());
    }
  }
}
