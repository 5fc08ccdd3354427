package io.tenderbridge.backend.exception;

import java.util.List;
import org.springframework.http.HttpStatus;

/**
 * Thrown when the tender state machine rejects a requested status change. The problem body lists
 * the statuses reachable from the current one so clients can render a precise message.
 */
public class InvalidTransitionException extends TenderProblemException {

  public InvalidTransitionException(String detail, List<String> allowedTransitions) {
    super(HttpStatus.BAD_REQUEST, "INVALID_TRANSITION", "Invalid status transition", detail);
    getBody().setProperty("allowedTransitions", allowedTransitions);
  }
}
