package io.worktrack.backend.pay;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * One technician's pay on one job. Amounts are rounded to cents; {@code totalPay} is the sum of the
 * rounded base pay, mileage pay, per diem and personal expenses. {@code profitShare} is
 * informational and not part of {@code totalPay}.
 *
 * @param minimumRate the technician's guaranteed hourly rate
 * @param calculatedRate pool allocation divided by hours, before the floor
 * @param effectiveRate base pay divided by hours, after the floor
 * @param weightedBasePay the technician's hours-proportional share of the pool
 * @param usingMinimum true when the floor replaced the weighted base pay
 */
public record TechnicianPay(
    UUID technicianId,
    String technicianName,
    BigDecimal hours,
    BigDecimal minimumRate,
    BigDecimal calculatedRate,
    BigDecimal effectiveRate,
    BigDecimal weightedBasePay,
    BigDecimal basePay,
    BigDecimal mileage,
    BigDecimal mileagePay,
    BigDecimal perDiem,
    BigDecimal personalExpenses,
    BigDecimal profitShare,
    BigDecimal totalPay,
    boolean usingMinimum,
    List<LocalDate> entryDates,
    List<UUID> entryIds) {

  public TechnicianPay {
    entryDates = List.copyOf(entryDates);
    entryIds = List.copyOf(entryIds);
  }
}
