package io.tenderbridge.backend.tender;

/** Outcome of {@link TenderStateMachine#validateTransition}. */
public record TransitionResult(boolean valid, boolean unchanged, String message) {

  static TransitionResult unchangedStatus() {
    return new TransitionResult(true, true, "Status unchanged");
  }

  static TransitionResult accepted() {
    return new TransitionResult(true, false, "Valid transition");
  }

  static TransitionResult rejected(String message) {
    return new TransitionResult(false, false, message);
  }
}
