package io.worktrack.backend.job;

import java.util.Map;
import java.util.Set;

/** Job lifecycle status. Cancelled jobs are excluded from pay calculation. */
public enum JobStatus {
  PENDING,
  ASSIGNED,
  IN_PROGRESS,
  COMPLETED,
  CANCELLED;

  private static final Map<JobStatus, Set<JobStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          PENDING, Set.of(ASSIGNED, IN_PROGRESS, COMPLETED, CANCELLED),
          ASSIGNED, Set.of(PENDING, IN_PROGRESS, COMPLETED, CANCELLED),
          IN_PROGRESS, Set.of(ASSIGNED, COMPLETED, CANCELLED),
          COMPLETED, Set.of(IN_PROGRESS),
          CANCELLED, Set.of(PENDING));

  /** Returns the set of statuses this status can transition to. */
  public Set<JobStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  /** Returns true if transitioning from this status to the target is allowed. */
  public boolean canTransitionTo(JobStatus target) {
    return allowedTransitions().contains(target);
  }
}
