package io.tenderbridge.backend.tender;

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

/**
 * A procurement opportunity posted by a company.
 *
 * <p>Status only changes through {@link TenderLifecycleService}, which validates every move with
 * {@link TenderStateMachine}. Cancellation fields and award fields are each written by a single
 * method so they are either all set or all absent.
 */
@Entity
@Table(name = "tenders")
public class Tender {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "title", nullable = false, length = 300)
  private String title;

  @Column(name = "description", length = 10000)
  private String description;

  @Column(name = "category", length = 100)
  private String category;

  @Column(name = "requirements", length = 10000)
  private String requirements;

  @Column(name = "closing_date", nullable = false)
  private Instant closingDate;

  @Column(name = "publish_at")
  private Instant publishAt;

  @Column(name = "budget", precision = 15, scale = 2)
  private BigDecimal budget;

  @Column(name = "owner_company_id", nullable = false)
  private UUID ownerCompanyId;

  @Column(name = "created_by_id", nullable = false)
  private UUID createdById;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TenderStatus status;

  @Column(name = "status_changed_at", nullable = false)
  private Instant statusChangedAt;

  // --- Cancellation ---

  @Column(name = "cancellation_reason", length = 1000)
  private String cancellationReason;

  @Column(name = "cancelled_by_id")
  private UUID cancelledById;

  @Column(name = "cancelled_at")
  private Instant cancelledAt;

  // --- Award outcome ---

  @Column(name = "winning_bid_id")
  private UUID winningBidId;

  @Column(name = "awarded_at")
  private Instant awardedAt;

  @Column(name = "awarded_by_id")
  private UUID awardedById;

  @Column(name = "award_justification", length = 4000)
  private String awardJustification;

  // --- Ledger commit proof (written by the award job worker) ---

  @Column(name = "ledger_commit_ref", length = 100)
  private String ledgerCommitRef;

  @Column(name = "ledger_content_hash", length = 100)
  private String ledgerContentHash;

  @Column(name = "ledger_committed_at")
  private Instant ledgerCommittedAt;

  // --- Metadata ---

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected Tender() {}

  public Tender(
      String title, Instant closingDate, UUID ownerCompanyId, UUID createdById, Instant now) {
    this.title = Objects.requireNonNull(title, "title must not be null");
    this.closingDate = Objects.requireNonNull(closingDate, "closingDate must not be null");
    this.ownerCompanyId = Objects.requireNonNull(ownerCompanyId, "ownerCompanyId must not be null");
    this.createdById = Objects.requireNonNull(createdById, "createdById must not be null");
    this.status = TenderStatus.DRAFT;
    this.statusChangedAt = Objects.requireNonNull(now, "now must not be null");
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

  // --- Lifecycle (package-private: only TenderLifecycleService moves the status) ---

  void applyStatus(TenderStatus newStatus, Instant now) {
    this.status = Objects.requireNonNull(newStatus, "newStatus must not be null");
    this.statusChangedAt = now;
  }

  void markCancelled(String reason, UUID actorId, Instant now) {
    this.cancellationReason = Objects.requireNonNull(reason, "reason must not be null");
    this.cancelledById = actorId;
    this.cancelledAt = now;
    applyStatus(TenderStatus.CANCELLED, now);
  }

  void markAwarded(UUID winningBidId, String justification, UUID actorId, Instant now) {
    this.winningBidId = Objects.requireNonNull(winningBidId, "winningBidId must not be null");
    this.awardJustification =
        Objects.requireNonNull(justification, "justification must not be null");
    this.awardedById = actorId;
    this.awardedAt = now;
    applyStatus(TenderStatus.AWARDED, now);
  }

  /** Stores the proof returned by the award ledger. Re-recording the same proof is a no-op. */
  public void recordLedgerCommit(String contentHash, String commitRef, Instant now) {
    if (this.status != TenderStatus.AWARDED) {
      throw new InvalidStateException(
          "Invalid tender state", "Cannot record ledger proof for tender in status " + status);
    }
    this.ledgerContentHash = Objects.requireNonNull(contentHash, "contentHash must not be null");
    if (commitRef != null) {
      this.ledgerCommitRef = commitRef;
    }
    if (this.ledgerCommittedAt == null) {
      this.ledgerCommittedAt = now;
    }
  }

  // --- Guards ---

  public boolean canReceiveBids() {
    return TenderStateMachine.canReceiveBids(status);
  }

  /** True while bidding is open and the closing deadline is strictly in the future. */
  public boolean isAcceptingBidsAt(Instant now) {
    return canReceiveBids() && now.isBefore(closingDate);
  }

  public boolean isEditable() {
    return TenderStateMachine.canEdit(status);
  }

  public boolean isTerminal() {
    return TenderStateMachine.isTerminal(status);
  }

  public boolean hasLedgerProof() {
    return ledgerContentHash != null;
  }

  public void requireEditable() {
    if (!isEditable()) {
      throw new InvalidStateException(
          "Invalid tender state",
          "Cannot edit tender in '%s' status. Only draft/published tenders can be edited."
              .formatted(status.value()));
    }
  }

  // --- Guarded setters for core fields ---

  public void setTitle(String title) {
    requireEditable();
    this.title = Objects.requireNonNull(title, "title must not be null");
  }

  public void setDescription(String description) {
    requireEditable();
    this.description = description;
  }

  public void setCategory(String category) {
    requireEditable();
    this.category = category;
  }

  public void setRequirements(String requirements) {
    requireEditable();
    this.requirements = requirements;
  }

  public void setClosingDate(Instant closingDate) {
    requireEditable();
    this.closingDate = Objects.requireNonNull(closingDate, "closingDate must not be null");
  }

  public void setPublishAt(Instant publishAt) {
    requireEditable();
    this.publishAt = publishAt;
  }

  public void setBudget(BigDecimal budget) {
    requireEditable();
    this.budget = budget;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public String getCategory() {
    return category;
  }

  public String getRequirements() {
    return requirements;
  }

  public Instant getClosingDate() {
    return closingDate;
  }

  public Instant getPublishAt() {
    return publishAt;
  }

  public BigDecimal getBudget() {
    return budget;
  }

  public UUID getOwnerCompanyId() {
    return ownerCompanyId;
  }

  public UUID getCreatedById() {
    return createdById;
  }

  public TenderStatus getStatus() {
    return status;
  }

  public Instant getStatusChangedAt() {
    return statusChangedAt;
  }

  public String getCancellationReason() {
    return cancellationReason;
  }

  public UUID getCancelledById() {
    return cancelledById;
  }

  public Instant getCancelledAt() {
    return cancelledAt;
  }

  public UUID getWinningBidId() {
    return winningBidId;
  }

  public Instant getAwardedAt() {
    return awardedAt;
  }

  public UUID getAwardedById() {
    return awardedById;
  }

  public String getAwardJustification() {
    return awardJustification;
  }

  public String getLedgerCommitRef() {
    return ledgerCommitRef;
  }

  public String getLedgerContentHash() {
    return ledgerContentHash;
  }

  public Instant getLedgerCommittedAt() {
    return ledgerCommittedAt;
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
