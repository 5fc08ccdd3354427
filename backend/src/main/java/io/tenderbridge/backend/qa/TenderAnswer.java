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

/** The tender owner's answer to a {@link TenderQuestion}. Editable by its author only. */
@Entity
@Table(name = "tender_answers")
public class TenderAnswer {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "question_id", nullable = false, updatable = false)
  private UUID questionId;

  @Column(name = "answered_by_id", nullable = false, updatable = false)
  private UUID answeredById;

  @Column(name = "answer_text", nullable = false, length = 5000)
  private String answerText;

  @Column(name = "answered_at", nullable = false, updatable = false)
  private Instant answeredAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TenderAnswer() {}

  public TenderAnswer(UUID questionId, UUID answeredById, String answerText, Instant now) {
    this.questionId = Objects.requireNonNull(questionId, "questionId must not be null");
    this.answeredById = Objects.requireNonNull(answeredById, "answeredById must not be null");
    this.answerText = Objects.requireNonNull(answerText, "answerText must not be null");
    this.answeredAt = Objects.requireNonNull(now, "now must not be null");
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

  void revise(String answerText) {
    this.answerText = Objects.requireNonNull(answerText, "answerText must not be null");
  }

  public boolean isAnsweredBy(UUID userId) {
    return userId != null && userId.equals(answeredById);
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getQuestionId() {
    return questionId;
  }

  public UUID getAnsweredById() {
    return answeredById;
  }

  public String getAnswerText() {
    return answerText;
  }

  public Instant getAnsweredAt() {
    return answeredAt;
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
