package io.tenderbridge.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base of the domain exceptions. Each renders as a problem response carrying a stable {@code code}
 * property that clients switch on instead of parsing the detail text.
 */
public abstract class TenderProblemException extends ErrorResponseException {

  protected TenderProblemException(HttpStatus status, String code, String title, String detail) {
    this(status, code, title, detail, null);
  }

  protected TenderProblemException(
      HttpStatus status, String code, String title, String detail, Throwable cause) {
    super(status, createProblem(status, code, title, detail), cause);
  }

  /** Machine-readable error name, e.g. {@code INVALID_STATE}. */
  public String getCode() {
    return (String) getBody().getProperties().get("code");
  }

  private static ProblemDetail createProblem(
      HttpStatus status, String code, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", code);
    return problem;
  }
}
