package io.worktrack.backend.payroll;

import io.worktrack.backend.job.BillingType;
import io.worktrack.backend.job.JobStatus;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/** Income and hours per job, independent of technicians. */
public record JobBillingReport(
    LocalDate fromDate, LocalDate toDate, List<JobLine> jobs, Summary summary) {

  /**
   * @param billingAmount null while the platform payout is unknown
   * @param jobNet billing minus expenses and commissions; null with the billing amount
   * @param payableHours hours on verified, billed and paid entries
   */
  public record JobLine(
      UUID jobId,
      String ticketNumber,
      String description,
      String clientName,
      String platformName,
      BillingType billingType,
      LocalDate jobDate,
      BigDecimal billingAmount,
      BigDecimal expenses,
      BigDecimal commissions,
      BigDecimal jobNet,
      BigDecimal payableHours,
      int entryCount,
      JobStatus jobStatus) {}

  public record Summary(
      int jobCount, BigDecimal totalBilling, BigDecimal totalNet, BigDecimal totalHours) {}
}
