package io.worktrack.backend.timeentry;

import io.worktrack.backend.exception.InvalidStateException;
import io.worktrack.backend.exception.MissingAssignmentException;
import io.worktrack.backend.exception.PermissionDeniedException;
import io.worktrack.backend.exception.ResourceNotFoundException;
import org.springframework.web.ErrorResponseException;

public enum TransitionFailureReason {
  NOT_FOUND,
  INVALID_TRANSITION,
  MISSING_ASSIGNMENT,
  MISSING_HOURS,
  PERMISSION_DENIED,
  STORAGE_ERROR;

  /** Conflicts, including a lost concurrent update, report as {@link #INVALID_TRANSITION}. */
  static TransitionFailureReason of(ErrorResponseException ex) {
    if (ex instanceof ResourceNotFoundException) {
      return NOT_FOUND;
    }
    if (ex instanceof MissingAssignmentException) {
      return MISSING_ASSIGNMENT;
    }
    if (ex instanceof PermissionDeniedException) {
      return PERMISSION_DENIED;
    }
    if (ex instanceof InvalidStateException) {
      return MISSING_HOURS;
    }
    return INVALID_TRANSITION;
  }
}
