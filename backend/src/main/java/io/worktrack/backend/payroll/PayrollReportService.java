package io.worktrack.backend.payroll;

import io.worktrack.backend.exception.IncompleteJobDataException;
import io.worktrack.backend.exception.InvalidStateException;
import io.worktrack.backend.exception.PermissionDeniedException;
import io.worktrack.backend.job.Job;
import io.worktrack.backend.job.JobRepository;
import io.worktrack.backend.job.JobStatus;
import io.worktrack.backend.mileagerate.MileageRateService;
import io.worktrack.backend.pay.JobPayCalculation;
import io.worktrack.backend.pay.PayCalculationService;
import io.worktrack.backend.pay.PayWarning;
import io.worktrack.backend.payroll.PayrollReport.Issue;
import io.worktrack.backend.payroll.PayrollReport.JobLine;
import io.worktrack.backend.payroll.PayrollReport.TechnicianPayroll;
import io.worktrack.backend.payroll.PayrollReport.Totals;
import io.worktrack.backend.platform.Platform;
import io.worktrack.backend.platform.PlatformRepository;
import io.worktrack.backend.security.AccessGuard;
import io.worktrack.backend.security.ActingUser;
import io.worktrack.backend.technician.Technician;
import io.worktrack.backend.technician.TechnicianRepository;
import io.worktrack.backend.technician.TechnicianService;
import io.worktrack.backend.timeentry.TimeEntry;
import io.worktrack.backend.timeentry.TimeEntryRepository;
import io.worktrack.backend.timeentry.TimeEntryStatus;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Rolls per-job pay calculations up into payroll, billing and hours reports. */
@Service
public class PayrollReportService {

  private static final Logger log = LoggerFactory.getLogger(PayrollReportService.class);

  private final TimeEntryRepository timeEntryRepository;
  private final JobRepository jobRepository;
  private final TechnicianRepository technicianRepository;
  private final PlatformRepository platformRepository;
  private final TechnicianService technicianService;
  private final MileageRateService mileageRateService;
  private final PayCalculationService payCalculationService;

  public PayrollReportService(
      TimeEntryRepository timeEntryRepository,
      JobRepository jobRepository,
      TechnicianRepository technicianRepository,
      PlatformRepository platformRepository,
      TechnicianService technicianService,
      MileageRateService mileageRateService,
      PayCalculationService payCalculationService) {
    this.timeEntryRepository = timeEntryRepository;
    this.jobRepository = jobRepository;
    this.technicianRepository = technicianRepository;
    this.platformRepository = platformRepository;
    this.technicianService = technicianService;
    this.mileageRateService = mileageRateService;
    this.payCalculationService = payCalculationService;
  }

  /**
   * Payroll for every technician with payable hours in the range, or for one technician when
   * {@code technicianId} is given. A job is included for a technician when they have a payable
   * entry in the range; its pay is calculated from all of the job's payable entries. A job that
   * cannot be calculated becomes an {@link Issue} and does not affect other jobs.
   */
  @Transactional(readOnly = true)
  public PayrollReport payrollReport(
      LocalDate fromDate, LocalDate toDate, UUID technicianId, ActingUser actor) {
    requireRange(fromDate, toDate);
    if (!actor.isManagerOrAdmin()
        && (technicianId == null || !actor.isTechnician(technicianId))) {
      throw new PermissionDeniedException("Technicians can only view their own payroll");
    }

    var jobsByTechnician = new LinkedHashMap<UUID, Set<UUID>>();
    for (var entry :
        timeEntryRepository.findByStatusInAndDateRange(TimeEntryStatus.PAYABLE, fromDate, toDate)) {
      if (!entry.isAssigned()
          || (technicianId != null && !technicianId.equals(entry.getTechnicianId()))) {
        continue;
      }
      jobsByTechnician
          .computeIfAbsent(entry.getTechnicianId(), id -> new LinkedHashSet<>())
          .add(entry.getJobId());
    }

    var jobIds =
        jobsByTechnician.values().stream()
            .flatMap(Set::stream)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    var jobs = loadJobs(jobIds);
    var rates = mileageRateService.rateTable();

    var calculations = new LinkedHashMap<UUID, JobPayCalculation>();
    var issues = new ArrayList<Issue>();
    var warnings = new ArrayList<PayWarning>();
    for (var jobId : jobIds) {
      var job = jobs.get(jobId);
      if (job == null) {
        continue;
      }
      try {
        var calculation = payCalculationService.calculate(job, rates);
        calculations.put(jobId, calculation);
        warnings.addAll(calculation.warnings());
      } catch (IncompleteJobDataException e) {
        log.warn("Payroll {} to {}: cannot calculate job {}", fromDate, toDate, jobId);
        issues.add(new Issue(jobId, job.getTicketNumber(), e.getBody().getDetail()));
      }
    }

    var technicians =
        jobsByTechnician.isEmpty()
            ? Map.<UUID, Technician>of()
            : byId(technicianRepository.findByIdIn(jobsByTechnician.keySet()), Technician::getId);
    var rows = new ArrayList<TechnicianPayroll>();
    var grandTotals = Totals.ZERO;
    for (var entry : jobsByTechnician.entrySet()) {
      var technician = technicians.get(entry.getKey());
      if (technician == null) {
        log.warn(
            "Payroll {} to {}: technician {} not found, leaving out jobs {}",
            fromDate,
            toDate,
            entry.getKey(),
            entry.getValue());
        for (var jobId : entry.getValue()) {
          var job = jobs.get(jobId);
          issues.add(
              new Issue(
                  jobId,
                  job != null ? job.getTicketNumber() : null,
                  "Technician " + entry.getKey() + " not found; their pay is left out"));
        }
        continue;
      }
      var row = technicianPayroll(technician, entry.getValue(), jobs, calculations);
      if (row.jobs().isEmpty()) {
        continue;
      }
      rows.add(row);
      grandTotals = grandTotals.add(row.totals());
    }
    rows.sort(
        Comparator.comparing(TechnicianPayroll::technicianName, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(TechnicianPayroll::technicianId));

    log.info(
        "Generated payroll report {} to {}: {} technicians, {} jobs, {} issues",
        fromDate,
        toDate,
        rows.size(),
        calculations.size(),
        issues.size());
    return new PayrollReport(fromDate, toDate, rows, grandTotals, issues, warnings);
  }

  /** Per-job billing, payable hours and net for jobs dated in the range. */
  @Transactional(readOnly = true)
  public JobBillingReport jobBillingReport(
      LocalDate fromDate,
      LocalDate toDate,
      UUID platformId,
      JobStatus jobStatus,
      ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "view the job billing report");
    requireRange(fromDate, toDate);

    var jobs =
        jobRepository
            .findByJobDateBetweenOrderByJobDateDescTicketNumberAsc(fromDate, toDate)
            .stream()
            .filter(job -> platformId == null || platformId.equals(job.getPlatformId()))
            .filter(job -> jobStatus == null || jobStatus == job.getJobStatus())
            .toList();
    var jobIds = jobs.stream().map(Job::getId).toList();
    Map<UUID, List<TimeEntry>> entriesByJob =
        jobIds.isEmpty()
            ? Map.of()
            : timeEntryRepository.findByJobIdInAndStatusIn(jobIds, TimeEntryStatus.PAYABLE).stream()
                .collect(Collectors.groupingBy(TimeEntry::getJobId));
    var platformIds = jobs.stream().map(Job::getPlatformId).collect(Collectors.toSet());
    var platforms = byId(platformRepository.findAllById(platformIds), Platform::getId);

    var lines = new ArrayList<JobBillingReport.JobLine>();
    var totalBilling = BigDecimal.ZERO;
    var totalNet = BigDecimal.ZERO;
    var totalHours = BigDecimal.ZERO;
    for (var job : jobs) {
      var entries = entriesByJob.getOrDefault(job.getId(), List.of());
      var hours = sumHours(entries);
      var platform = platforms.get(job.getPlatformId());
      var line =
          new JobBillingReport.JobLine(
              job.getId(),
              job.getTicketNumber(),
              job.getDescription(),
              job.getClientName(),
              platform != null ? platform.getName() : null,
              job.getBillingType(),
              job.getJobDate(),
              job.getBillingAmount(),
              job.getExpenses(),
              job.getCommissions(),
              job.getNetAmount(),
              hours,
              entries.size(),
              job.getJobStatus());
      lines.add(line);
      if (line.billingAmount() != null) {
        totalBilling = totalBilling.add(line.billingAmount());
        totalNet = totalNet.add(line.jobNet());
      }
      totalHours = totalHours.add(hours);
    }

    log.info("Generated job billing report {} to {}: {} jobs", fromDate, toDate, lines.size());
    return new JobBillingReport(
        fromDate,
        toDate,
        lines,
        new JobBillingReport.Summary(lines.size(), totalBilling, totalNet, totalHours));
  }

  /** Hours a technician logged in the range, in any status, grouped by day, week or job. */
  @Transactional(readOnly = true)
  public TechnicianHoursReport technicianHoursReport(
      UUID technicianId,
      LocalDate fromDate,
      LocalDate toDate,
      HoursGrouping groupBy,
      ActingUser actor) {
    if (!actor.isManagerOrAdmin() && !actor.isTechnician(technicianId)) {
      throw new PermissionDeniedException("Technicians can only view their own hours");
    }
    requireRange(fromDate, toDate);
    var technician = technicianService.requireTechnician(technicianId);
    var grouping = groupBy != null ? groupBy : HoursGrouping.DAY;
    var entries = timeEntryRepository.findByTechnicianAndDateRange(technicianId, fromDate, toDate);

    var buckets =
        switch (grouping) {
          case DAY -> dateBuckets(entries, TimeEntry::getDateWorked);
          case WEEK ->
              dateBuckets(
                  entries,
                  entry ->
                      entry
                          .getDateWorked()
                          .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)));
          case JOB -> jobBuckets(entries);
        };
    var total =
        buckets.stream()
            .map(TechnicianHoursReport.Bucket::hours)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    return new TechnicianHoursReport(
        technicianId, technician.getName(), fromDate, toDate, grouping, buckets, total);
  }

  private TechnicianPayroll technicianPayroll(
      Technician technician,
      Set<UUID> jobIds,
      Map<UUID, Job> jobs,
      Map<UUID, JobPayCalculation> calculations) {
    var lines = new ArrayList<JobLine>();
    for (var jobId : jobIds) {
      var calculation = calculations.get(jobId);
      if (calculation == null) {
        continue;
      }
      var job = jobs.get(jobId);
      calculation
          .forTechnician(technician.getId())
          .ifPresent(
              pay ->
                  lines.add(
                      JobLine.of(
                          jobId,
                          job.getTicketNumber(),
                          job.getDescription(),
                          job.getExternalUrl(),
                          job.getBillingAmount(),
                          pay)));
    }
    lines.sort(
        Comparator.comparing(
                JobLine::firstDate, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(
                JobLine::ticketNumber, Comparator.nullsLast(Comparator.<String>naturalOrder())));

    var totals = Totals.ZERO;
    for (var line : lines) {
      totals = totals.add(line);
    }
    return new TechnicianPayroll(
        technician.getId(), technician.getName(), technician.getHourlyRate(), lines, totals);
  }

  private static List<TechnicianHoursReport.Bucket> dateBuckets(
      List<TimeEntry> entries, Function<TimeEntry, LocalDate> key) {
    var groups = new TreeMap<LocalDate, List<TimeEntry>>();
    for (var entry : entries) {
      groups.computeIfAbsent(key.apply(entry), k -> new ArrayList<>()).add(entry);
    }
    var buckets = new ArrayList<TechnicianHoursReport.Bucket>();
    groups.forEach(
        (date, group) ->
            buckets.add(
                new TechnicianHoursReport.Bucket(
                    date.toString(), date, null, group.size(), sumHours(group))));
    return buckets;
  }

  private List<TechnicianHoursReport.Bucket> jobBuckets(List<TimeEntry> entries) {
    var groups = new LinkedHashMap<UUID, List<TimeEntry>>();
    for (var entry : entries) {
      groups.computeIfAbsent(entry.getJobId(), k -> new ArrayList<>()).add(entry);
    }
    var jobs = loadJobs(groups.keySet());
    var buckets = new ArrayList<TechnicianHoursReport.Bucket>();
    groups.forEach(
        (jobId, group) -> {
          var job = jobs.get(jobId);
          var label =
              job == null
                  ? jobId.toString()
                  : Objects.requireNonNullElse(job.getTicketNumber(), job.getDescription());
          buckets.add(
              new TechnicianHoursReport.Bucket(
                  label, group.get(0).getDateWorked(), jobId, group.size(), sumHours(group)));
        });
    return buckets;
  }

  private static BigDecimal sumHours(List<TimeEntry> entries) {
    return entries.stream()
        .map(TimeEntry::getHoursWorked)
        .filter(Objects::nonNull)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  private Map<UUID, Job> loadJobs(Set<UUID> jobIds) {
    return jobIds.isEmpty() ? Map.of() : byId(jobRepository.findByIdIn(jobIds), Job::getId);
  }

  private static <T> Map<UUID, T> byId(Iterable<T> items, Function<T, UUID> id) {
    var map = new LinkedHashMap<UUID, T>();
    for (var item : items) {
      map.put(id.apply(item), item);
    }
    return map;
  }

  private static void requireRange(LocalDate fromDate, LocalDate toDate) {
    if (fromDate == null || toDate == null) {
      throw new InvalidStateException("Date range required", "Both from and to dates are required");
    }
    if (toDate.isBefore(fromDate)) {
      throw new InvalidStateException(
          "Invalid date range", "The to date " + toDate + " is before the from date " + fromDate);
    }
  }
}
