package io.tenderbridge.backend.ledger.job;

import io.tenderbridge.backend.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** A durable award ledger commit job. Rows are never deleted; they double as the commit audit. */
@Entity
@Table(name = "ledger_jobs")
public class LedgerJob {

  static final int MAX_ERROR_LENGTH = 2000;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "job_name", nullable = false, length = 100)
  private String jobName;

  @Column(name = "tender_id", nullable = false)
  private UUID tenderId;

  @Column(name = "winning_bid_id", nullable = false)
  private UUID winningBidId;

  @Column(name = "award_amount", nullable = false, precision = 15, scale = 2)
  private BigDecimal awardAmount;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private LedgerJobStatus status;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "next_attempt_at", nullable = false)
  private Instant nextAttemptAt;

  @Column(name = "started_at")
  private Instant startedAt;

  @Column(name = "finished_at")
  private Instant finishedAt;

  @Column(name = "last_error", length = MAX_ERROR_LENGTH)
  private String lastError;

  // --- Result ---

  @Column(name = "content_hash", length = 100)
  private String contentHash;

  @Column(name = "commit_ref", length = 100)
  private String commitRef;

  // --- Metadata ---

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected LedgerJob() {}

  public LedgerJob(String jobName, AwardCommitPayload payload, Instant now) {
    this.jobName = Objects.requireNonNull(jobName, "jobName must not be null");
    this.tenderId = payload.tenderId();
    this.winningBidId = payload.winningBidId();
    this.awardAmount = payload.awardAmount();
    this.status = LedgerJobStatus.ENQUEUED;
    this.attempts = 0;
    this.nextAttemptAt = Objects.requireNonNull(now, "now must not be null");
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  public AwardCommitPayload payload() {
    return new AwardCommitPayload(tenderId, winningBidId, awardAmount);
  }

  // --- State transitions ---

  void markRunning(Instant now) {
    requireStatus(LedgerJobStatus.ENQUEUED, "start");
    this.status = LedgerJobStatus.RUNNING;
    this.attempts++;
    this.startedAt = now;
  }

  void markCommitted(String contentHash, String commitRef, Instant now) {
    requireStatus(LedgerJobStatus.RUNNING, "complete");
    this.status = LedgerJobStatus.COMMITTED;
    this.contentHash = contentHash;
    this.commitRef = commitRef;
    this.lastError = null;
    this.finishedAt = now;
  }

  void scheduleRetry(String error, Instant retryAt) {
    requireStatus(LedgerJobStatus.RUNNING, "retry");
    this.status = LedgerJobStatus.ENQUEUED;
    this.lastError = truncate(error);
    this.nextAttemptAt = retryAt;
  }

  void markFailed(String error, Instant now) {
    requireStatus(LedgerJobStatus.RUNNING, "fail");
    this.status = LedgerJobStatus.FAILED;
    this.lastError = truncate(error);
    this.finishedAt = now;
  }

  /** Puts a RUNNING job whose worker disappeared back in the queue. The attempt still counts. */
  void recoverStale(Instant now) {
    requireStatus(LedgerJobStatus.RUNNING, "recover");
    this.status = LedgerJobStatus.ENQUEUED;
    this.lastError = "Worker did not finish within the running timeout";
    this.nextAttemptAt = now;
  }

  /** Gives a dead-lettered job a fresh set of attempts. */
  void requeue(Instant now) {
    requireStatus(LedgerJobStatus.FAILED, "requeue");
    this.status = LedgerJobStatus.ENQUEUED;
    this.attempts = 0;
    this.nextAttemptAt = now;
    this.finishedAt = null;
  }

  private void requireStatus(LedgerJobStatus expected, String action) {
    if (status != expected) {
      throw new InvalidStateException(
          "Invalid job state",
          "Cannot %s ledger job in status '%s'".formatted(action, status.value()));
    }
  }

  private static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getJobName() {
    return jobName;
  }

  public UUID getTenderId() {
    return tenderId;
  }

  public UUID getWinningBidId() {
    return winningBidId;
  }

  public BigDecimal getAwardAmount() {
    return awardAmount;
  }

  public LedgerJobStatus getStatus() {
    return status;
  }

  public int getAttempts() {
    return attempts;
  }

  public Instant getNextAttemptAt() {
    return nextAttemptAt;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getFinishedAt() {
    return finishedAt;
  }

  public String getLastError() {
    return lastError;
  }

  public String getContentHash() {
    return contentHash;
  }

  public String getCommitRef() {
    return commitRef;
  }

  public long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
