package io.worktrack.backend.pay;

public enum PayWarningType {
  /** Payable entry without a technician; left out of the calculation. */
  UNASSIGNED_ENTRY,
  /** Entry has mileage but no rate covers its date; mileage pay counted as zero. */
  RATE_NOT_FOUND
}
