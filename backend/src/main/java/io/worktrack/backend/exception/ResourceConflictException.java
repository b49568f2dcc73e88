package io.worktrack.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a new record would clash with one already stored, such as an overlapping pay period
 * or a second mileage rate starting on the same day. The problem names the clashing record.
 */
public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String resourceType, Object conflictsWith, String detail) {
    super(HttpStatus.CONFLICT, createProblem(resourceType, conflictsWith, detail), null);
  }

  private static ProblemDetail createProblem(
      String resourceType, Object conflictsWith, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Conflicting " + resourceType);
    problem.setDetail(detail);
    problem.setProperty("resourceType", resourceType);
    problem.setProperty("conflictsWith", String.valueOf(conflictsWith));
    return problem;
  }
}
