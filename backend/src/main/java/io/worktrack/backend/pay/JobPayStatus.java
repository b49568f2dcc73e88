package io.worktrack.backend.pay;

public enum JobPayStatus {
  CALCULATED,
  /** No assigned, payable hours; nothing to allocate. */
  NO_PAYABLE_HOURS,
  /** Cancelled jobs are not paid. */
  EXCLUDED
}
