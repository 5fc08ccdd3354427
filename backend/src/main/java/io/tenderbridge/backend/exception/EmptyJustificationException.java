package io.tenderbridge.backend.exception;

import org.springframework.http.HttpStatus;

public class EmptyJustificationException extends TenderProblemException {

  public EmptyJustificationException() {
    super(
        HttpStatus.BAD_REQUEST,
        "EMPTY_JUSTIFICATION",
        "Award justification required",
        "An award decision must include a non-blank justification");
  }
}
