package io.worktrack.backend.payroll;

import io.worktrack.backend.pay.PayWarning;
import io.worktrack.backend.pay.TechnicianPay;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Payroll over a date range, grouped by technician. {@code grandTotals} is the sum of the
 * technicians' subtotals, which are sums of their rounded job lines. Jobs whose pay cannot be
 * calculated are listed in {@code issues} and contribute nothing.
 */
public record PayrollReport(
    LocalDate fromDate,
    LocalDate toDate,
    List<TechnicianPayroll> technicians,
    Totals grandTotals,
    List<Issue> issues,
    List<PayWarning> warnings) {

  public record TechnicianPayroll(
      UUID technicianId,
      String technicianName,
      BigDecimal minimumRate,
      List<JobLine> jobs,
      Totals totals) {}

  /** One technician's pay on one job, with the job details shown on the payroll sheet. */
  public record JobLine(
      UUID jobId,
      String ticketNumber,
      String description,
      String externalUrl,
      BigDecimal billingAmount,
      List<LocalDate> entryDates,
      String dateDisplay,
      BigDecimal hours,
      BigDecimal effectiveRate,
      boolean usingMinimum,
      BigDecimal basePay,
      BigDecimal mileage,
      BigDecimal mileagePay,
      BigDecimal perDiem,
      BigDecimal personalExpenses,
      BigDecimal profitShare,
      BigDecimal totalPay) {

    static JobLine of(
        UUID jobId,
        String ticketNumber,
        String description,
        String externalUrl,
        BigDecimal billingAmount,
        TechnicianPay pay) {
      return new JobLine(
          jobId,
          ticketNumber,
          description,
          externalUrl,
          billingAmount,
          pay.entryDates(),
          dateDisplay(pay.entryDates()),
          pay.hours(),
          pay.effectiveRate(),
          pay.usingMinimum(),
          pay.basePay(),
          pay.mileage(),
          pay.mileagePay(),
          pay.perDiem(),
          pay.personalExpenses(),
          pay.profitShare(),
          pay.totalPay());
    }

    /** {@code "2026-01-05"} for a single day, {@code "2026-01-05 - 2026-01-07"} for a span. */
    static String dateDisplay(List<LocalDate> dates) {
      if (dates.isEmpty()) {
        return null;
      }
      var first = dates.get(0);
      var last = dates.get(dates.size() - 1);
      return first.equals(last) ? first.toString() : first + " - " + last;
    }

    LocalDate firstDate() {
      return entryDates.isEmpty() ? null : entryDates.get(0);
    }
  }

  public record Totals(
      BigDecimal hours,
      BigDecimal basePay,
      BigDecimal mileagePay,
      BigDecimal perDiem,
      BigDecimal personalExpenses,
      BigDecimal profitShare,
      BigDecimal totalPay) {

    public static final Totals ZERO =
        new Totals(
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            BigDecimal.ZERO);

    Totals add(JobLine line) {
      return new Totals(
          hours.add(line.hours()),
          basePay.add(line.basePay()),
          mileagePay.add(line.mileagePay()),
          perDiem.add(line.perDiem()),
          personalExpenses.add(line.personalExpenses()),
          profitShare.add(line.profitShare()),
          totalPay.add(line.totalPay()));
    }

    Totals add(Totals other) {
      return new Totals(
          hours.add(other.hours()),
          basePay.add(other.basePay()),
          mileagePay.add(other.mileagePay()),
          perDiem.add(other.perDiem()),
          personalExpenses.add(other.personalExpenses()),
          profitShare.add(other.profitShare()),
          totalPay.add(other.totalPay()));
    }
  }

  /** A job shown as "cannot calculate" instead of being silently zeroed. */
  public record Issue(UUID jobId, String ticketNumber, String detail) {}
}
