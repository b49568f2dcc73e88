package io.worktrack.backend.importing;

import io.worktrack.backend.audit.AuditEventBuilder;
import io.worktrack.backend.audit.AuditService;
import io.worktrack.backend.job.BillingType;
import io.worktrack.backend.job.Job;
import io.worktrack.backend.job.JobRepository;
import io.worktrack.backend.job.JobStatus;
import io.worktrack.backend.payperiod.PayPeriod;
import io.worktrack.backend.payperiod.PayPeriodRepository;
import io.worktrack.backend.platform.Platform;
import io.worktrack.backend.platform.PlatformRepository;
import io.worktrack.backend.security.AccessGuard;
import io.worktrack.backend.security.ActingUser;
import io.worktrack.backend.timeentry.HoursCalculator;
import io.worktrack.backend.timeentry.TimeEntry;
import io.worktrack.backend.timeentry.TimeEntryRepository;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Accepts work orders from platform scrapers. Jobs are matched by external URL, then by platform
 * job code; new jobs are created completed. Time logs become unassigned drafts unless an entry with
 * the same job, date and hours exists. Each work order is imported in its own transaction and its
 * failure is reported without stopping the rest.
 */
@Service
public class TimeEntryImportService {

  private static final Logger log = LoggerFactory.getLogger(TimeEntryImportService.class);

  private static final String IMPORT_SOURCE = "IMPORT";

  private final JobRepository jobRepository;
  private final PlatformRepository platformRepository;
  private final TimeEntryRepository timeEntryRepository;
  private final PayPeriodRepository payPeriodRepository;
  private final AuditService auditService;
  private final TransactionTemplate transactionTemplate;

  public TimeEntryImportService(
      JobRepository jobRepository,
      PlatformRepository platformRepository,
      TimeEntryRepository timeEntryRepository,
      PayPeriodRepository payPeriodRepository,
      AuditService auditService,
      TransactionTemplate transactionTemplate) {
    this.jobRepository = jobRepository;
    this.platformRepository = platformRepository;
    this.timeEntryRepository = timeEntryRepository;
    this.payPeriodRepository = payPeriodRepository;
    this.auditService = auditService;
    this.transactionTemplate = transactionTemplate;
  }

  public ImportSummary importWorkOrders(List<WorkOrderCandidate> workOrders, ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "import work orders");
    int importedJobs = 0;
    int skippedJobs = 0;
    int importedEntries = 0;
    int skippedEntries = 0;
    var errors = new ArrayList<String>();

    for (var workOrder : workOrders) {
      try {
        var outcome = transactionTemplate.execute(status -> importWorkOrder(workOrder, actor));
        if (outcome.jobCreated()) {
          importedJobs++;
        } else {
          skippedJobs++;
        }
        importedEntries += outcome.importedEntries();
        skippedEntries += outcome.skippedEntries();
        errors.addAll(outcome.errors());
      } catch (RuntimeException e) {
        log.warn("Import of work order {} failed", workOrder.workOrderId(), e);
        errors.add("Work order " + workOrder.workOrderId() + ": " + e.getMessage());
      }
    }

    log.info(
        "Imported {} work orders: {} jobs created, {} matched, {} entries created, {} skipped,"
            + " {} errors",
        workOrders.size(),
        importedJobs,
        skippedJobs,
        importedEntries,
        skippedEntries,
        errors.size());
    return new ImportSummary(importedJobs, skippedJobs, importedEntries, skippedEntries, errors);
  }

  private WorkOrderOutcome importWorkOrder(WorkOrderCandidate workOrder, ActingUser actor) {
    if (workOrder.platformCode() == null || workOrder.platformCode().isBlank()) {
      throw new IllegalArgumentException("platform code is required");
    }
    var platform = findOrCreatePlatform(workOrder);
    var existing = findExistingJob(workOrder, platform);
    var job = existing.orElseGet(() -> createJob(workOrder, platform, actor));

    int imported = 0;
    int skipped = 0;
    var errors = new ArrayList<String>();
    for (var candidate : workOrder.timeEntries()) {
      var date = candidate.dateWorked() != null ? candidate.dateWorked() : job.getJobDate();
      if (date == null) {
        errors.add("Work order " + workOrder.workOrderId() + ": time entry without a date");
        continue;
      }
      var hours =
          HoursCalculator.resolveHours(candidate.hours(), candidate.timeIn(), candidate.timeOut());
      if (hours != null && hours.signum() < 0) {
        errors.add("Work order " + workOrder.workOrderId() + ": negative hours on " + date);
        continue;
      }
      if (timeEntryRepository.existsByJobIdAndDateWorkedAndHoursWorked(job.getId(), date, hours)) {
        skipped++;
        continue;
      }

      var entry = new TimeEntry(job.getId(), null, date, actor.userId());
      entry.recordTime(candidate.timeIn(), candidate.timeOut(), candidate.hours());
      entry.recordAmounts(candidate.mileage(), null, null);
      entry.setNotes(
          "Imported from " + platform.getName() + " work order " + workOrder.workOrderId());
      entry.attachToPayPeriod(
          payPeriodRepository.findOpenContaining(date).map(PayPeriod::getId).orElse(null));
      entry = timeEntryRepository.save(entry);
      imported++;

      var details = new LinkedHashMap<String, Object>();
      details.put("job_id", job.getId().toString());
      details.put("date_worked", date.toString());
      details.put("hours_worked", hours != null ? hours.toString() : "");
      auditService.log(
          AuditEventBuilder.builder()
              .eventType("time_entry.created")
              .entityType("time_entry")
              .entityId(entry.getId())
              .actor(actor)
              .source(IMPORT_SOURCE)
              .details(details)
              .build());
    }
    log.debug(
        "Work order {}: job {} ({}), {} entries created, {} skipped",
        workOrder.workOrderId(),
        job.getId(),
        existing.isPresent() ? "matched" : "created",
        imported,
        skipped);
    return new WorkOrderOutcome(existing.isEmpty(), imported, skipped, errors);
  }

  private Optional<Job> findExistingJob(WorkOrderCandidate workOrder, Platform platform) {
    if (workOrder.externalUrl() != null && !workOrder.externalUrl().isBlank()) {
      var byUrl = jobRepository.findFirstByExternalUrl(workOrder.externalUrl());
      if (byUrl.isPresent()) {
        return byUrl;
      }
    }
    if (workOrder.workOrderId() != null && !workOrder.workOrderId().isBlank()) {
      return jobRepository.findFirstByPlatformIdAndPlatformJobCode(
          platform.getId(), workOrder.workOrderId());
    }
    return Optional.empty();
  }

  private Job createJob(WorkOrderCandidate workOrder, Platform platform, ActingUser actor) {
    var description =
        workOrder.title() != null && !workOrder.title().isBlank()
            ? truncate(workOrder.title(), 500)
            : platform.getName() + " #" + workOrder.workOrderId();
    var job =
        new Job(
            platform.getId(),
            platform.getCode() + "-" + workOrder.workOrderId(),
            description,
            BillingType.FLAT_RATE,
            workOrder.totalPay(),
            workOrder.scheduledDate());
    job.setPlatformJobCode(workOrder.workOrderId());
    job.setExternalUrl(workOrder.externalUrl());
    job.setClientName(
        workOrder.clientName() != null
            ? truncate(workOrder.clientName(), 200)
            : platform.getName());
    job.changeStatus(JobStatus.COMPLETED);
    job = jobRepository.save(job);
    log.info("Imported job {} for work order {}", job.getId(), workOrder.workOrderId());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("job.created")
            .entityType("job")
            .entityId(job.getId())
            .actor(actor)
            .source(IMPORT_SOURCE)
            .details(
                Map.of(
                    "ticket_number", job.getTicketNumber(),
                    "external_url", workOrder.externalUrl() != null ? workOrder.externalUrl() : ""))
            .build());
    return job;
  }

  private Platform findOrCreatePlatform(WorkOrderCandidate workOrder) {
    var code = workOrder.platformCode().trim();
    return platformRepository
        .findByCode(code)
        .orElseGet(
            () -> {
              var name = workOrder.platformName() != null ? workOrder.platformName() : code;
              log.info("Creating platform {} ({})", name, code);
              return platformRepository.save(new Platform(name, code));
            });
  }

  private static String truncate(String value, int maxLength) {
    return value.length() <= maxLength ? value : value.substring(0, maxLength);
  }

  private record WorkOrderOutcome(
      boolean jobCreated, int importedEntries, int skippedEntries, List<String> errors) {}
}
