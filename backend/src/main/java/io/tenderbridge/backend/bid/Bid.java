package io.tenderbridge.backend.bid;

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
 * One company's priced offer against one tender. A revision creates a new row whose {@code
 * parentBidId} points at the row it replaced; the replaced row becomes SUPERSEDED.
 *
 * <p>Status changes go through {@link BidLedger}; the mutators here only guard the terminal states.
 */
@Entity
@Table(name = "bids")
public class Bid {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tender_id", nullable = false, updatable = false)
  private UUID tenderId;

  @Column(name = "company_id", nullable = false, updatable = false)
  private UUID companyId;

  @Column(name = "submitted_by_id", nullable = false, updatable = false)
  private UUID submittedById;

  @Column(name = "amount", nullable = false, precision = 15, scale = 2)
  private BigDecimal amount;

  @Column(name = "document_ref", length = 500)
  private String documentRef;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private BidStatus status;

  @Column(name = "revision_number", nullable = false, updatable = false)
  private int revisionNumber;

  @Column(name = "parent_bid_id", updatable = false)
  private UUID parentBidId;

  @Column(name = "submitted_at", nullable = false, updatable = false)
  private Instant submittedAt;

  @Column(name = "withdrawn_at")
  private Instant withdrawnAt;

  @Column(name = "withdrawal_reason", length = 1000)
  private String withdrawalReason;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected Bid() {}

  /** Creates an original (revision 1) bid. */
  public Bid(
      UUID tenderId,
      UUID companyId,
      UUID submittedById,
      BigDecimal amount,
      String documentRef,
      Instant now) {
    this(tenderId, companyId, submittedById, amount, documentRef, 1, null, now);
  }

  private Bid(
      UUID tenderId,
      UUID companyId,
      UUID submittedById,
      BigDecimal amount,
      String documentRef,
      int revisionNumber,
      UUID parentBidId,
      Instant now) {
    this.tenderId = Objects.requireNonNull(tenderId, "tenderId must not be null");
    this.companyId = Objects.requireNonNull(companyId, "companyId must not be null");
    this.submittedById = Objects.requireNonNull(submittedById, "submittedById must not be null");
    this.amount = Objects.requireNonNull(amount, "amount must not be null");
    this.documentRef = documentRef;
    this.status = BidStatus.PENDING;
    this.revisionNumber = revisionNumber;
    this.parentBidId = parentBidId;
    this.submittedAt = Objects.requireNonNull(now, "now must not be null");
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

  /**
   * Builds the next revision of this bid. The document reference carries forward unless a new one
   * is supplied. The caller is responsible for marking this row superseded.
   */
  Bid nextRevision(UUID revisedById, BigDecimal newAmount, String newDocumentRef, Instant now) {
    if (id == null) {
      throw new IllegalStateException("Cannot revise a bid that has not been persisted");
    }
    return new Bid(
        tenderId,
        companyId,
        revisedById,
        newAmount,
        newDocumentRef != null ? newDocumentRef : documentRef,
        revisionNumber + 1,
        id,
        now);
  }

  void markWithdrawn(String reason, Instant now) {
    requireLive("withdraw");
    this.status = BidStatus.WITHDRAWN;
    this.withdrawalReason = reason;
    this.withdrawnAt = now;
  }

  void markSuperseded() {
    requireLive("revise");
    this.status = BidStatus.SUPERSEDED;
  }

  void markShortlisted() {
    requireStatus(BidStatus.PENDING, "shortlist");
    this.status = BidStatus.SHORTLISTED;
  }

  void clearShortlist() {
    requireStatus(BidStatus.SHORTLISTED, "remove from the shortlist");
    this.status = BidStatus.PENDING;
  }

  void markAccepted() {
    requireNotWithdrawn("accept");
    this.status = BidStatus.ACCEPTED;
  }

  void markRejected() {
    requireNotWithdrawn("reject");
    this.status = BidStatus.REJECTED;
  }

  public boolean isWithdrawn() {
    return status == BidStatus.WITHDRAWN;
  }

  public boolean isSuperseded() {
    return status == BidStatus.SUPERSEDED;
  }

  public boolean isOwnedBy(UUID companyId) {
    return companyId != null && companyId.equals(this.companyId);
  }

  private void requireLive(String action) {
    if (status == BidStatus.WITHDRAWN || status == BidStatus.SUPERSEDED) {
      throw new InvalidStateException(
          "Invalid bid state", "Cannot " + action + " bid in status " + status.value());
    }
  }

  private void requireStatus(BidStatus expected, String action) {
    if (status != expected) {
      throw new InvalidStateException(
          "Invalid bid state", "Cannot " + action + " bid in status " + status.value());
    }
  }

  private void requireNotWithdrawn(String action) {
    if (status == BidStatus.WITHDRAWN) {
      throw new InvalidStateException(
          "Invalid bid state", "Cannot " + action + " bid in status " + status.value());
    }
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getTenderId() {
    return tenderId;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public UUID getSubmittedById() {
    return submittedById;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getDocumentRef() {
    return documentRef;
  }

  public BidStatus getStatus() {
    return status;
  }

  public int getRevisionNumber() {
    return revisionNumber;
  }

  public UUID getParentBidId() {
    return parentBidId;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public Instant getWithdrawnAt() {
    return withdrawnAt;
  }

  public String getWithdrawalReason() {
    return withdrawalReason;
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
