package io.tenderbridge.backend.tender;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tender lifecycle rules. Pure functions over {@link TenderStatus}; no persistence and no side
 * effects.
 *
 * <pre>
 * DRAFT → PUBLISHED → OPEN → EVALUATION → AWARDED
 *                       ↘ CLOSED ↗     ↘ OPEN
 * (any non-terminal) → CANCELLED, with a reason
 * </pre>
 */
public final class TenderStateMachine {

  private static final Map<TenderStatus, Set<TenderStatus>> TRANSITIONS =
      new EnumMap<>(TenderStatus.class);

  static {
    TRANSITIONS.put(
        TenderStatus.DRAFT, EnumSet.of(TenderStatus.PUBLISHED, TenderStatus.CANCELLED));
    TRANSITIONS.put(
        TenderStatus.PUBLISHED, EnumSet.of(TenderStatus.OPEN, TenderStatus.CANCELLED));
    TRANSITIONS.put(
        TenderStatus.OPEN,
        EnumSet.of(TenderStatus.EVALUATION, TenderStatus.CLOSED, TenderStatus.CANCELLED));
    TRANSITIONS.put(
        TenderStatus.EVALUATION,
        EnumSet.of(TenderStatus.AWARDED, TenderStatus.OPEN, TenderStatus.CANCELLED));
    TRANSITIONS.put(
        TenderStatus.CLOSED, EnumSet.of(TenderStatus.EVALUATION, TenderStatus.CANCELLED));
    TRANSITIONS.put(TenderStatus.AWARDED, EnumSet.noneOf(TenderStatus.class));
    TRANSITIONS.put(TenderStatus.CANCELLED, EnumSet.noneOf(TenderStatus.class));
  }

  private TenderStateMachine() {}

  public static boolean canTransition(TenderStatus from, TenderStatus to) {
    return TRANSITIONS.get(from).contains(to);
  }

  /** Statuses reachable from {@code current}, in declaration order. */
  public static List<TenderStatus> allowedTransitions(TenderStatus current) {
    return List.copyOf(TRANSITIONS.get(current));
  }

  /**
   * Validates a requested move. Same-status requests are accepted as a no-op; moves to CANCELLED
   * additionally need a non-blank reason.
   */
  public static TransitionResult validateTransition(
      TenderStatus from, TenderStatus to, String reason) {
    if (from == to) {
      return TransitionResult.unchangedStatus();
    }
    if (!canTransition(from, to)) {
      return TransitionResult.rejected(
          "Cannot transition from '%s' to '%s'. Allowed: %s"
              .formatted(from.value(), to.value(), allowedValues(from)));
    }
    if (to == TenderStatus.CANCELLED && (reason == null || reason.isBlank())) {
      return TransitionResult.rejected("Cancellation requires a reason");
    }
    return TransitionResult.accepted();
  }

  public static List<String> allowedValues(TenderStatus current) {
    return allowedTransitions(current).stream().map(TenderStatus::value).toList();
  }

  public static boolean isTerminal(TenderStatus status) {
    return status == TenderStatus.AWARDED || status == TenderStatus.CANCELLED;
  }

  public static boolean canReceiveBids(TenderStatus status) {
    return status == TenderStatus.OPEN;
  }

  public static boolean canEdit(TenderStatus status) {
    return status == TenderStatus.DRAFT || status == TenderStatus.PUBLISHED;
  }

  /** Bidders may ask clarification questions before and during bidding. */
  public static boolean canReceiveQuestions(TenderStatus status) {
    return status == TenderStatus.PUBLISHED || status == TenderStatus.OPEN;
  }

  /** Bidding has stopped and the owner may shortlist bids. */
  public static boolean canEvaluateBids(TenderStatus status) {
    return status == TenderStatus.EVALUATION || status == TenderStatus.CLOSED;
  }

  public static boolean canAward(TenderStatus status) {
    return status == TenderStatus.EVALUATION;
  }
}
