package io.worktrack.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a lifecycle transition is attempted from a status that does not allow it, or when a
 * concurrent writer changed the status first. Results in HTTP 409 Conflict.
 */
public class InvalidTransitionException extends ErrorResponseException {

  public InvalidTransitionException(String detail) {
    super(HttpStatus.CONFLICT, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Invalid transition");
    problem.setDetail(detail);
    return problem;
  }
}
