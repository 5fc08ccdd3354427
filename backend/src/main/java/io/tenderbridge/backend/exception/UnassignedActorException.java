package io.tenderbridge.backend.exception;

import org.springframework.http.HttpStatus;

/** Thrown when an operation requires a company affiliation the acting user does not have. */
public class UnassignedActorException extends TenderProblemException {

  public UnassignedActorException(String action) {
    super(
        HttpStatus.BAD_REQUEST,
        "UNASSIGNED",
        "User must belong to a company",
        "A company affiliation is required to " + action);
  }
}
