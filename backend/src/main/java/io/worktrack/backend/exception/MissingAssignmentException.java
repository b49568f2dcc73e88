package io.worktrack.backend.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when an unassigned time entry is submitted. Results in HTTP 422. */
public class MissingAssignmentException extends ErrorResponseException {

  public MissingAssignmentException(UUID timeEntryId) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(timeEntryId), null);
  }

  private static ProblemDetail createProblem(UUID timeEntryId) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Missing assignment");
    problem.setDetail(
        "Time entry " + timeEntryId + " must be assigned to a technician before submission");
    problem.setProperty("timeEntryId", timeEntryId);
    return problem;
  }
}
