package io.tenderbridge.backend.qa;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** A clarification question on a tender. It carries at most one {@link TenderAnswer}. */
@Entity
@Table(name = "tender_questions")
public class TenderQuestion {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tender_id", nullable = false, updatable = false)
  private UUID tenderId;

  @Column(name = "asked_by_id", nullable = false, updatable = false)
  private UUID askedById;

  @Column(name = "asked_by_company_id", updatable = false)
  private UUID askedByCompanyId;

  @Column(name = "question_text", nullable = false, length = 2000)
  private String questionText;

  @Column(name = "answered", nullable = false)
  private boolean answered;

  @Column(name = "asked_at", nullable = false, updatable = false)
  private Instant askedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TenderQuestion() {}

  public TenderQuestion(
      UUID tenderId, UUID askedById, UUID askedByCompanyId, String questionText, Instant now) {
    this.tenderId = Objects.requireNonNull(tenderId, "tenderId must not be null");
    this.askedById = Objects.requireNonNull(askedById, "askedById must not be null");
    this.askedByCompanyId = askedByCompanyId;
    this.questionText = Objects.requireNonNull(questionText, "questionText must not be null");
    this.askedAt = Objects.requireNonNull(now, "now must not be null");
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

  void markAnswered() {
    this.answered = true;
  }

  public boolean isAskedBy(UUID userId) {
    return userId != null && userId.equals(askedById);
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getTenderId() {
    return tenderId;
  }

  public UUID getAskedById() {
    return askedById;
  }

  public UUID getAskedByCompanyId() {
    return askedByCompanyId;
  }

  public String getQuestionText() {
    return questionText;
  }

  public boolean isAnswered() {
    return answered;
  }

  public Instant getAskedAt() {
    return askedAt;
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
