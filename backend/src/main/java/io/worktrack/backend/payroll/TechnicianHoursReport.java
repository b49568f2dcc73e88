package io.worktrack.backend.payroll;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record TechnicianHoursReport(
    UUID technicianId,
    String technicianName,
    LocalDate fromDate,
    LocalDate toDate,
    HoursGrouping groupBy,
    List<Bucket> buckets,
    BigDecimal totalHours) {

  /**
   * One group of entries. {@code startDate} is the day or week start for date groupings;
   * {@code jobId} is set for job grouping.
   */
  public record Bucket(
      String label, LocalDate startDate, UUID jobId, int entryCount, BigDecimal hours) {}
}
