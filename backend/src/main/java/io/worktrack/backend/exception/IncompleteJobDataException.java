package io.worktrack.backend.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a job lacks the data pay calculation needs (a billing amount). Results in HTTP 422;
 * the payroll report turns it into a "cannot calculate" row for that job only.
 */
public class IncompleteJobDataException extends ErrorResponseException {

  private final UUID jobId;

  public IncompleteJobDataException(UUID jobId, String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(jobId, detail), null);
    this.jobId = jobId;
  }

  public UUID getJobId() {
    return jobId;
  }

  private static ProblemDetail createProblem(UUID jobId, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Incomplete job data");
    problem.setDetail(detail);
    problem.setProperty("jobId", jobId);
    return problem;
  }
}
