package io.worktrack.backend.payroll;

public enum HoursGrouping {
  DAY,
  /** Weeks start on Monday. */
  WEEK,
  JOB
}
