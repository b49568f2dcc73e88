package io.worktrack.backend.pay;

import static io.worktrack.backend.pay.PayMath.cents;
import static io.worktrack.backend.pay.PayMath.divide;
import static io.worktrack.backend.pay.PayMath.orZero;

import io.worktrack.backend.exception.IncompleteJobDataException;
import io.worktrack.backend.job.Job;
import io.worktrack.backend.mileagerate.MileageRateTable;
import io.worktrack.backend.technician.Technician;
import io.worktrack.backend.timeentry.TimeEntry;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a job's payable hours into technician pay.
 *
 * <ol>
 *   <li>job net = billing amount - expenses - commissions
 *   <li>tech pool = job net x tech pool share (never below zero)
 *   <li>each technician's weighted base pay = pool x (their hours / total hours)
 *   <li>if weighted base pay / hours is below the technician's hourly rate, base pay = rate x hours
 *       (the floor never reduces anyone else's pay)
 *   <li>mileage pay = mileage x the rate in effect on each entry's date
 *   <li>total pay = base pay + mileage pay + per diem + personal expenses
 *   <li>profit share = job net - total base pay, split by hours, reported but not paid
 * </ol>
 *
 * <p>Stateless and side-effect free: the same inputs always produce the same result.
 */
@Component
public class PayCalculator {

  private static final Logger log = LoggerFactory.getLogger(PayCalculator.class);

  private static final Comparator<TechnicianPay> ROW_ORDER =
      Comparator.comparing(TechnicianPay::technicianName, String.CASE_INSENSITIVE_ORDER)
          .thenComparing(TechnicianPay::technicianId);

  private final PayrollProperties properties;

  public PayCalculator(PayrollProperties properties) {
    this.properties = properties;
  }

  /**
   * Calculates pay for one job.
   *
   * @param entries the job's time entries; entries that are not payable are ignored
   * @param technicians technicians referenced by the entries, keyed by id
   * @param mileageRates rate history used to price each entry's mileage
   * @throws IncompleteJobDataException if the job has payable hours but no billing amount
   */
  public JobPayCalculation calculate(
      Job job,
      Collection<TimeEntry> entries,
      Map<UUID, Technician> technicians,
      MileageRateTable mileageRates) {
    var warnings = new ArrayList<PayWarning>();
    if (job.isCancelled()) {
      return JobPayCalculation.empty(
          job.getId(), JobPayStatus.EXCLUDED, job.getNetAmount(), warnings);
    }

    var byTechnician = new LinkedHashMap<UUID, Accumulator>();
    for (var entry : entries) {
      if (!entry.getStatus().isPayable()) {
        continue;
      }
      if (!entry.isAssigned()) {
        log.warn("Job {}: payable time entry {} has no technician", job.getId(), entry.getId());
        warnings.add(
            new PayWarning(
                PayWarningType.UNASSIGNED_ENTRY,
                entry.getId(),
                null,
                entry.getDateWorked(),
                "Entry has no technician and is excluded until assigned"));
        continue;
      }
      byTechnician
          .computeIfAbsent(entry.getTechnicianId(), Accumulator::new)
          .add(entry, mileagePay(job, entry, mileageRates, warnings));
    }

    var totalHours =
        byTechnician.values().stream().map(a -> a.hours).reduce(BigDecimal.ZERO, BigDecimal::add);
    if (totalHours.signum() == 0) {
      return JobPayCalculation.empty(
          job.getId(), JobPayStatus.NO_PAYABLE_HOURS, job.getNetAmount(), warnings);
    }

    var jobNet = job.getNetAmount();
    if (jobNet == null) {
      throw new IncompleteJobDataException(
          job.getId(),
          "Job " + describe(job) + " has payable hours but no billing amount");
    }
    var techPool = jobNet.multiply(properties.techPoolShare()).max(BigDecimal.ZERO);

    var rows = new ArrayList<Row>();
    for (var acc : byTechnician.values()) {
      rows.add(allocate(acc, technicians.get(acc.technicianId), techPool, totalHours));
    }

    var roundedBasePay =
        rows.stream()
            .map(row -> cents(row.basePay))
            .reduce(cents(BigDecimal.ZERO), BigDecimal::add);
    var profitShare = cents(jobNet).subtract(roundedBasePay);
    var technicianPays = shareProfit(rows, profitShare, totalHours);
    log.debug(
        "Job {}: net {}, pool {}, {} hours across {} technicians",
        job.getId(),
        jobNet,
        techPool,
        totalHours,
        technicianPays.size());

    return new JobPayCalculation(
        job.getId(),
        JobPayStatus.CALCULATED,
        cents(jobNet),
        cents(techPool),
        totalHours,
        roundedBasePay,
        profitShare,
        technicianPays,
        warnings);
  }

  private Row allocate(
      Accumulator acc, Technician technician, BigDecimal techPool, BigDecimal totalHours) {
    var minimumRate = technician != null ? orZero(technician.getHourlyRate()) : BigDecimal.ZERO;
    var name = technician != null ? technician.getName() : "Technician " + acc.technicianId;
    var weighted = divide(techPool.multiply(acc.hours), totalHours);

    var row = new Row(acc, name, minimumRate, weighted);
    if (acc.hours.signum() == 0) {
      row.calculatedRate = BigDecimal.ZERO;
      row.basePay = BigDecimal.ZERO;
      return row;
    }
    row.calculatedRate = divide(weighted, acc.hours);
    row.basePay = weighted;
    if (properties.minimumRateFloor() && row.calculatedRate.compareTo(minimumRate) < 0) {
      row.basePay = minimumRate.multiply(acc.hours);
      row.usingMinimum = true;
    }
    return row;
  }

  /**
   * Splits the job-level profit share, already in cents, by hours and builds the rounded rows. The
   * rounded shares always add up to it; any cent left over goes to the row with the most hours.
   */
  private List<TechnicianPay> shareProfit(
      List<Row> rows, BigDecimal profitShare, BigDecimal totalHours) {
    var target = profitShare;
    var allocated = BigDecimal.ZERO;
    for (var row : rows) {
      row.profitShare = cents(divide(profitShare.multiply(row.acc.hours), totalHours));
      allocated = allocated.add(row.profitShare);
    }

    var ordered = new ArrayList<TechnicianPay>();
    for (var row : rows) {
      ordered.add(row.toPay());
    }
    ordered.sort(ROW_ORDER);

    var remainder = target.subtract(allocated);
    if (remainder.signum() != 0) {
      int largest = 0;
      for (int i = 1; i < ordered.size(); i++) {
        if (ordered.get(i).hours().compareTo(ordered.get(largest).hours()) > 0) {
          largest = i;
        }
      }
      var row = ordered.get(largest);
      ordered.set(largest, withProfitShare(row, row.profitShare().add(remainder)));
    }
    return ordered;
  }

  private BigDecimal mileagePay(
      Job job, TimeEntry entry, MileageRateTable mileageRates, List<PayWarning> warnings) {
    var mileage = orZero(entry.getMileage());
    if (mileage.signum() == 0) {
      return BigDecimal.ZERO;
    }
    var rate = mileageRates.rateOn(entry.getDateWorked());
    if (rate.isEmpty()) {
      log.warn(
          "Job {}: no mileage rate effective on {} for entry {}",
          job.getId(),
          entry.getDateWorked(),
          entry.getId());
      warnings.add(
          new PayWarning(
              PayWarningType.RATE_NOT_FOUND,
              entry.getId(),
              entry.getTechnicianId(),
              entry.getDateWorked(),
              "No mileage rate effective on " + entry.getDateWorked() + "; mileage pay is zero"));
      return BigDecimal.ZERO;
    }
    return mileage.multiply(rate.get());
  }

  private static TechnicianPay withProfitShare(TechnicianPay pay, BigDecimal profitShare) {
    return new TechnicianPay(
        pay.technicianId(),
        pay.technicianName(),
        pay.hours(),
        pay.minimumRate(),
        pay.calculatedRate(),
        pay.effectiveRate(),
        pay.weightedBasePay(),
        pay.basePay(),
        pay.mileage(),
        pay.mileagePay(),
        pay.perDiem(),
        pay.personalExpenses(),
        profitShare,
        pay.totalPay(),
        pay.usingMinimum(),
        pay.entryDates(),
        pay.entryIds());
  }

  private static String describe(Job job) {
    return job.getTicketNumber() != null ? job.getTicketNumber() : job.getId().toString();
  }

  /** Per-technician sums over the job's payable entries. */
  private static final class Accumulator {
    private final UUID technicianId;
    private BigDecimal hours = BigDecimal.ZERO;
    private BigDecimal mileage = BigDecimal.ZERO;
    private BigDecimal mileagePay = BigDecimal.ZERO;
    private BigDecimal perDiem = BigDecimal.ZERO;
    private BigDecimal personalExpenses = BigDecimal.ZERO;
    private final TreeSet<LocalDate> dates = new TreeSet<>();
    private final List<UUID> entryIds = new ArrayList<>();

    private Accumulator(UUID technicianId) {
      this.technicianId = technicianId;
    }

    private void add(TimeEntry entry, BigDecimal entryMileagePay) {
      hours = hours.add(orZero(entry.getHoursWorked()));
      mileage = mileage.add(orZero(entry.getMileage()));
      mileagePay = mileagePay.add(entryMileagePay);
      perDiem = perDiem.add(orZero(entry.getPerDiem()));
      personalExpenses = personalExpenses.add(orZero(entry.getPersonalExpenses()));
      dates.add(entry.getDateWorked());
      entryIds.add(entry.getId());
    }
  }

  /** Full-precision working values for one technician. */
  private static final class Row {
    private final Accumulator acc;
    private final String name;
    private final BigDecimal minimumRate;
    private final BigDecimal weightedBasePay;
    private BigDecimal calculatedRate;
    private BigDecimal basePay;
    private BigDecimal profitShare;
    private boolean usingMinimum;

    private Row(Accumulator acc, String name, BigDecimal minimumRate, BigDecimal weighted) {
      this.acc = acc;
      this.name = name;
      this.minimumRate = minimumRate;
      this.weightedBasePay = weighted;
    }

    private TechnicianPay toPay() {
      var base = cents(basePay);
      var mileagePay = cents(acc.mileagePay);
      var perDiem = cents(acc.perDiem);
      var personalExpenses = cents(acc.personalExpenses);
      var effectiveRate =
          acc.hours.signum() > 0 ? cents(divide(basePay, acc.hours)) : cents(BigDecimal.ZERO);
      return new TechnicianPay(
          acc.technicianId,
          name,
          acc.hours,
          cents(minimumRate),
          cents(calculatedRate),
          effectiveRate,
          cents(weightedBasePay),
          base,
          cents(acc.mileage),
          mileagePay,
          perDiem,
          personalExpenses,
          profitShare,
          base.add(mileagePay).add(perDiem).add(personalExpenses),
          usingMinimum,
          List.copyOf(acc.dates),
          acc.entryIds);
    }
  }
}
