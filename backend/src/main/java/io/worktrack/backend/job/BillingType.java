package io.worktrack.backend.job;

public enum BillingType {
  FLAT_RATE,
  HOURLY,
  PER_TASK
}
