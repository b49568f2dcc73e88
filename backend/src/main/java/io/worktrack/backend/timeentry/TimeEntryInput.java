package io.worktrack.backend.timeentry;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Editable fields of a time entry. {@code hoursWorked}, when present, overrides the hours derived
 * from {@code timeIn}/{@code timeOut}. On create, null money fields are stored as zero; on update,
 * null fields keep their current value.
 */
public record TimeEntryInput(
    UUID jobId,
    UUID technicianId,
    LocalDate dateWorked,
    LocalTime timeIn,
    LocalTime timeOut,
    BigDecimal hoursWorked,
    BigDecimal mileage,
    BigDecimal perDiem,
    BigDecimal personalExpenses,
    String notes) {

  /** Shorthand for an entry logged as a plain number of hours. */
  public static TimeEntryInput ofHours(
      UUID jobId, UUID technicianId, LocalDate dateWorked, BigDecimal hoursWorked) {
    return new TimeEntryInput(
        jobId, technicianId, dateWorked, null, null, hoursWorked, null, null, null, null);
  }
}
