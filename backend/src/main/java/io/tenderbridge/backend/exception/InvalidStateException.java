package io.tenderbridge.backend.exception;

import org.springframework.http.HttpStatus;

/** The target is in a status that does not allow the requested operation. */
public class InvalidStateException extends TenderProblemException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, "INVALID_STATE", title, detail);
  }
}
