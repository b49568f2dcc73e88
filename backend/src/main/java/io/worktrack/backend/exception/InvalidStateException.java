package io.worktrack.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a request is well-formed but the record it targets is not in a state that allows
 * it: a locked time entry, a pay period with unverified entries, a negative amount. Results in
 * HTTP 400 Bad Request.
 */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail, null), null);
  }

  private InvalidStateException(String title, String detail, String field) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail, field), null);
  }

  /** A rejected input value; the problem carries the offending field name. */
  public static InvalidStateException forField(String field, String detail) {
    return new InvalidStateException("Invalid " + field, detail, field);
  }

  private static ProblemDetail createProblem(String title, String detail, String field) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    if (field != null) {
      problem.setProperty("field", field);
    }
    return problem;
  }
}
