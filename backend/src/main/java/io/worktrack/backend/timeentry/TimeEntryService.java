package io.worktrack.backend.timeentry;

import io.worktrack.backend.audit.AuditEventBuilder;
import io.worktrack.backend.audit.AuditService;
import io.worktrack.backend.exception.InvalidStateException;
import io.worktrack.backend.exception.InvalidTransitionException;
import io.worktrack.backend.exception.MissingAssignmentException;
import io.worktrack.backend.exception.PermissionDeniedException;
import io.worktrack.backend.exception.ResourceNotFoundException;
import io.worktrack.backend.job.JobRepository;
import io.worktrack.backend.payperiod.PayPeriod;
import io.worktrack.backend.payperiod.PayPeriodRepository;
import io.worktrack.backend.security.AccessGuard;
import io.worktrack.backend.security.ActingUser;
import io.worktrack.backend.technician.TechnicianRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.ErrorResponseException;

/**
 * Time entry lifecycle: create, edit, assign and the draft/submitted/verified/billed/paid
 * transitions. Each transition re-reads the entry, checks its status and flushes against the
 * entry's version, so of two concurrent transitions on one entry exactly one succeeds and the
 * other fails with {@link InvalidTransitionException}.
 */
@Service
public class TimeEntryService {

  private static final Logger log = LoggerFactory.getLogger(TimeEntryService.class);

  private final TimeEntryRepository timeEntryRepository;
  private final JobRepository jobRepository;
  private final TechnicianRepository technicianRepository;
  private final PayPeriodRepository payPeriodRepository;
  private final AuditService auditService;
  private final TransactionTemplate transactionTemplate;

  public TimeEntryService(
      TimeEntryRepository timeEntryRepository,
      JobRepository jobRepository,
      TechnicianRepository technicianRepository,
      PayPeriodRepository payPeriodRepository,
      AuditService auditService,
      TransactionTemplate transactionTemplate) {
    this.timeEntryRepository = timeEntryRepository;
    this.jobRepository = jobRepository;
    this.technicianRepository = technicianRepository;
    this.payPeriodRepository = payPeriodRepository;
    this.auditService = auditService;
    this.transactionTemplate = transactionTemplate;
  }

  @Transactional
  public TimeEntry createTimeEntry(TimeEntryInput input, ActingUser actor) {
    if (input.jobId() == null || input.dateWorked() == null) {
      throw new InvalidStateException("Invalid time entry", "Job and date worked are required");
    }
    requireJobExists(input.jobId());
    validateAmounts(input);

    UUID technicianId = input.technicianId();
    if (!actor.isManagerOrAdmin()) {
      if (actor.technicianId() == null
          || (technicianId != null && !actor.isTechnician(technicianId))) {
        throw new PermissionDeniedException("Technicians can only log time for themselves");
      }
      technicianId = actor.technicianId();
    }
    if (technicianId != null) {
      requireActiveTechnician(technicianId);
    }

    var entry = new TimeEntry(input.jobId(), technicianId, input.dateWorked(), actor.userId());
    entry.recordTime(input.timeIn(), input.timeOut(), input.hoursWorked());
    entry.recordAmounts(input.mileage(), input.perDiem(), input.personalExpenses());
    entry.setNotes(input.notes());
    entry.attachToPayPeriod(openPeriodFor(input.dateWorked()));

    var saved = timeEntryRepository.save(entry);
    log.info(
        "Created time entry {} for job {} (technician {}, {} hours)",
        saved.getId(),
        saved.getJobId(),
        saved.getTechnicianId(),
        saved.getHoursWorked());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("time_entry.created")
            .entityType("time_entry")
            .entityId(saved.getId())
            .actor(actor)
            .details(new LinkedHashMap<>(snapshot(saved)))
            .build());
    return saved;
  }

  /**
   * Changes the fields present in {@code input}; a null field keeps its current value. New clock
   * times without explicit hours recompute the hours. Only managers and admins may move an entry
   * to another job or technician.
   */
  @Transactional
  public TimeEntry updateTimeEntry(UUID entryId, TimeEntryInput input, ActingUser actor) {
    var entry = requireEntry(entryId);
    requireEditPermission(entry, actor);
    validateAmounts(input);

    UUID jobId = input.jobId() != null ? input.jobId() : entry.getJobId();
    UUID technicianId =
        input.technicianId() != null ? input.technicianId() : entry.getTechnicianId();
    LocalDate dateWorked = input.dateWorked() != null ? input.dateWorked() : entry.getDateWorked();
    boolean reassigning =
        !jobId.equals(entry.getJobId()) || !Objects.equals(technicianId, entry.getTechnicianId());
    if (reassigning) {
      AccessGuard.requireManagerOrAdmin(actor, "move time entries to another job or technician");
      requireJobExists(jobId);
      if (technicianId != null && !technicianId.equals(entry.getTechnicianId())) {
        requireActiveTechnician(technicianId);
      }
    }

    var before = snapshot(entry);
    boolean dateChanged = !dateWorked.equals(entry.getDateWorked());
    entry.reschedule(jobId, dateWorked);
    if (technicianId != null && !technicianId.equals(entry.getTechnicianId())) {
      entry.assignTechnician(technicianId, actor.userId());
    }
    LocalTime timeIn = valueOr(input.timeIn(), entry.getTimeIn());
    LocalTime timeOut = valueOr(input.timeOut(), entry.getTimeOut());
    boolean clockChanged = input.timeIn() != null || input.timeOut() != null;
    BigDecimal hours =
        input.hoursWorked() != null || clockChanged ? input.hoursWorked() : entry.getHoursWorked();
    entry.recordTime(timeIn, timeOut, hours);
    entry.recordAmounts(
        valueOr(input.mileage(), entry.getMileage()),
        valueOr(input.perDiem(), entry.getPerDiem()),
        valueOr(input.personalExpenses(), entry.getPersonalExpenses()));
    entry.setNotes(valueOr(input.notes(), entry.getNotes()));
    if (dateChanged) {
      entry.attachToPayPeriod(openPeriodFor(dateWorked));
    }
    entry.touch(actor.userId());
    entry = flush(entry);
    log.info("Updated time entry {}", entryId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("time_entry.updated")
            .entityType("time_entry")
            .entityId(entryId)
            .actor(actor)
            .details(delta(before, snapshot(entry)))
            .build());
    return entry;
  }

  @Transactional
  public void deleteTimeEntry(UUID entryId, ActingUser actor) {
    var entry = requireEntry(entryId);
    if (!actor.isManagerOrAdmin() && !actor.isTechnician(entry.getTechnicianId())) {
      throw new PermissionDeniedException("Technicians can only delete their own time entries");
    }
    if (entry.getStatus() != TimeEntryStatus.DRAFT) {
      throw new InvalidStateException(
          "Time entry locked",
          "Only draft time entries can be deleted (status " + entry.getStatus() + ")");
    }
    var details = new LinkedHashMap<String, Object>(snapshot(entry));
    timeEntryRepository.delete(entry);
    log.info("Deleted time entry {}", entryId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("time_entry.deleted")
            .entityType("time_entry")
            .entityId(entryId)
            .actor(actor)
            .details(details)
            .build());
  }

  /** Resolves an unassigned (typically imported) entry to an active technician. */
  @Transactional
  public TimeEntry assignTechnician(UUID entryId, UUID technicianId, ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "assign technicians to time entries");
    var entry = requireEntry(entryId);
    if (entry.getStatus() == TimeEntryStatus.BILLED || entry.getStatus() == TimeEntryStatus.PAID) {
      throw new InvalidStateException(
          "Time entry locked", "Cannot reassign a " + entry.getStatus() + " time entry");
    }
    requireActiveTechnician(technicianId);

    UUID previous = entry.getTechnicianId();
    entry.assignTechnician(technicianId, actor.userId());
    entry = flush(entry);
    log.info("Assigned time entry {} to technician {}", entryId, technicianId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("time_entry.assigned")
            .entityType("time_entry")
            .entityId(entryId)
            .actor(actor)
            .details(
                Map.of(
                    "technician_id",
                    Map.of(
                        "from", previous != null ? previous.toString() : "",
                        "to", technicianId.toString())))
            .build());
    return entry;
  }

  @Transactional
  public TimeEntry submit(UUID entryId, ActingUser actor) {
    return applySubmit(entryId, actor);
  }

  @Transactional
  public TimeEntry verify(UUID entryId, ActingUser actor) {
    return applyVerify(entryId, actor);
  }

  @Transactional
  public TimeEntry reject(UUID entryId, String reason, ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "reject time entries");
    if (reason == null || reason.isBlank()) {
      throw new InvalidStateException(
          "Rejection reason required", "A rejection reason is required");
    }
    var entry = requireEntry(entryId);
    entry.reject(reason.trim(), actor.userId());
    entry = flush(entry);
    log.info("Rejected time entry {}: {}", entryId, entry.getRejectionReason());

    var details = new LinkedHashMap<String, Object>();
    details.put("status", statusChange(TimeEntryStatus.SUBMITTED, TimeEntryStatus.DRAFT));
    details.put("reason", entry.getRejectionReason());
    auditStatus("time_entry.rejected", entry, actor, details);
    return entry;
  }

  @Transactional
  public TimeEntry markBilled(UUID entryId, ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "mark time entries billed");
    var entry = requireEntry(entryId);
    entry.markBilled(actor.userId());
    entry = flush(entry);
    log.info("Marked time entry {} billed", entryId);
    auditStatus(
        "time_entry.billed",
        entry,
        actor,
        Map.of("status", statusChange(TimeEntryStatus.VERIFIED, TimeEntryStatus.BILLED)));
    return entry;
  }

  @Transactional
  public TimeEntry markPaid(UUID entryId, ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "mark time entries paid");
    var entry = requireEntry(entryId);
    entry.markPaid(actor.userId());
    entry = flush(entry);
    log.info("Marked time entry {} paid", entryId);
    auditStatus(
        "time_entry.paid",
        entry,
        actor,
        Map.of("status", statusChange(TimeEntryStatus.BILLED, TimeEntryStatus.PAID)));
    return entry;
  }

  /** Submits each entry in its own transaction and reports the outcome per entry. */
  public BulkTransitionResult bulkSubmit(Collection<UUID> entryIds, ActingUser actor) {
    return applyEach(entryIds, id -> applySubmit(id, actor), "submit");
  }

  /** Verifies each entry in its own transaction and reports the outcome per entry. */
  public BulkTransitionResult bulkVerify(Collection<UUID> entryIds, ActingUser actor) {
    return applyEach(entryIds, id -> applyVerify(id, actor), "verify");
  }

  @Transactional(readOnly = true)
  public TimeEntry requireEntry(UUID entryId) {
    return timeEntryRepository
        .findById(entryId)
        .orElseThrow(() -> new ResourceNotFoundException("TimeEntry", entryId));
  }

  @Transactional(readOnly = true)
  public List<TimeEntry> listEntriesForJob(UUID jobId) {
    return timeEntryRepository.findByJobIdOrderByDateWorkedAscCreatedAtAsc(jobId);
  }

  @Transactional(readOnly = true)
  public List<TimeEntry> listEntriesForTechnician(
      UUID technicianId, LocalDate fromDate, LocalDate toDate, ActingUser actor) {
    if (!actor.isManagerOrAdmin() && !actor.isTechnician(technicianId)) {
      throw new PermissionDeniedException("Technicians can only view their own time entries");
    }
    return timeEntryRepository.findByTechnicianAndDateRange(technicianId, fromDate, toDate);
  }

  @Transactional(readOnly = true)
  public List<TimeEntry> listUnassignedEntries(ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "view unassigned time entries");
    return timeEntryRepository.findByTechnicianIdIsNullOrderByDateWorkedAsc();
  }

  private TimeEntry applySubmit(UUID entryId, ActingUser actor) {
    var entry = requireEntry(entryId);
    if (!entry.getStatus().canTransitionTo(TimeEntryStatus.SUBMITTED)) {
      throw new InvalidTransitionException(
          "Time entry " + entryId + " cannot be submitted from status " + entry.getStatus());
    }
    if (!entry.isAssigned()) {
      throw new MissingAssignmentException(entryId);
    }
    if (!actor.isManagerOrAdmin() && !actor.isTechnician(entry.getTechnicianId())) {
      throw new PermissionDeniedException("Technicians can only submit their own time entries");
    }
    if (!entry.hasHours()) {
      throw new InvalidStateException(
          "Missing hours", "Time entry " + entryId + " has no hours to submit");
    }
    entry.submit(actor.userId());
    entry = flush(entry);
    log.info("Submitted time entry {}", entryId);
    auditStatus(
        "time_entry.submitted",
        entry,
        actor,
        Map.of("status", statusChange(TimeEntryStatus.DRAFT, TimeEntryStatus.SUBMITTED)));
    return entry;
  }

  private TimeEntry applyVerify(UUID entryId, ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "verify time entries");
    var entry = requireEntry(entryId);
    entry.verify(actor.userId());
    entry = flush(entry);
    log.info("Verified time entry {} by {}", entryId, actor.userId());
    auditStatus(
        "time_entry.verified",
        entry,
        actor,
        Map.of("status", statusChange(TimeEntryStatus.SUBMITTED, TimeEntryStatus.VERIFIED)));
    return entry;
  }

  private BulkTransitionResult applyEach(
      Collection<UUID> entryIds, Function<UUID, TimeEntry> transition, String action) {
    var succeeded = new ArrayList<UUID>();
    var failed = new ArrayList<TransitionFailure>();
    for (var entryId : new LinkedHashSet<>(entryIds)) {
      if (entryId == null) {
        failed.add(
            new TransitionFailure(null, TransitionFailureReason.NOT_FOUND, "Missing entry id"));
        continue;
      }
      try {
        transactionTemplate.execute(status -> transition.apply(entryId));
        succeeded.add(entryId);
      } catch (ErrorResponseException e) {
        var reason = TransitionFailureReason.of(e);
        log.debug("Bulk {} skipped time entry {}: {}", action, entryId, reason);
        failed.add(new TransitionFailure(entryId, reason, e.getBody().getDetail()));
      } catch (OptimisticLockingFailureException e) {
        log.warn("Bulk {} lost a concurrent update on time entry {}", action, entryId);
        failed.add(
            new TransitionFailure(
                entryId,
                TransitionFailureReason.INVALID_TRANSITION,
                "Time entry " + entryId + " was modified concurrently"));
      } catch (DataAccessException e) {
        log.error("Bulk {} failed to store time entry {}", action, entryId, e);
        failed.add(
            new TransitionFailure(
                entryId,
                TransitionFailureReason.STORAGE_ERROR,
                "Time entry " + entryId + " could not be stored: " + e.getMessage()));
      }
    }
    log.info("Bulk {}: {} succeeded, {} failed", action, succeeded.size(), failed.size());
    return new BulkTransitionResult(succeeded, failed);
  }

  /** Writes the entry now so a stale version surfaces as a failed transition. */
  private TimeEntry flush(TimeEntry entry) {
    try {
      return timeEntryRepository.saveAndFlush(entry);
    } catch (OptimisticLockingFailureException e) {
      log.warn("Concurrent modification of time entry {}", entry.getId());
      throw new InvalidTransitionException(
          "Time entry " + entry.getId() + " was modified concurrently; reload and retry");
    }
  }

  private void requireEditPermission(TimeEntry entry, ActingUser actor) {
    var status = entry.getStatus();
    boolean editable;
    if (actor.isAdmin()) {
      editable = status != TimeEntryStatus.PAID;
    } else if (actor.isManagerOrAdmin()) {
      editable = status != TimeEntryStatus.BILLED && status != TimeEntryStatus.PAID;
    } else {
      if (!actor.isTechnician(entry.getTechnicianId())) {
        throw new PermissionDeniedException("Technicians can only edit their own time entries");
      }
      editable = TimeEntryStatus.PENDING.contains(status);
    }
    if (!editable) {
      throw new InvalidStateException(
          "Time entry locked", "A " + status + " time entry cannot be edited by " + actor.role());
    }
  }

  private void requireJobExists(UUID jobId) {
    if (!jobRepository.existsById(jobId)) {
      throw new ResourceNotFoundException("Job", jobId);
    }
  }

  private void requireActiveTechnician(UUID technicianId) {
    var technician =
        technicianRepository
            .findById(technicianId)
            .orElseThrow(() -> new ResourceNotFoundException("Technician", technicianId));
    if (!technician.isActive()) {
      throw new InvalidStateException(
          "Inactive technician", "Technician " + technician.getName() + " is inactive");
    }
  }

  private UUID openPeriodFor(LocalDate date) {
    return payPeriodRepository.findOpenContaining(date).map(PayPeriod::getId).orElse(null);
  }

  private static <T> T valueOr(T value, T current) {
    return value != null ? value : current;
  }

  private static void validateAmounts(TimeEntryInput input) {
    requireNonNegative("hours", input.hoursWorked());
    requireNonNegative("mileage", input.mileage());
    requireNonNegative("per diem", input.perDiem());
    requireNonNegative("personal expenses", input.personalExpenses());
  }

  private static void requireNonNegative(String field, BigDecimal value) {
    if (value != null && value.signum() < 0) {
      throw InvalidStateException.forField(field, "The " + field + " cannot be negative");
    }
  }

  private void auditStatus(
      String eventType, TimeEntry entry, ActingUser actor, Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("time_entry")
            .entityId(entry.getId())
            .actor(actor)
            .details(details)
            .build());
  }

  private static Map<String, String> statusChange(TimeEntryStatus from, TimeEntryStatus to) {
    return Map.of("from", from.name(), "to", to.name());
  }

  private static Map<String, String> snapshot(TimeEntry entry) {
    var values = new LinkedHashMap<String, String>();
    values.put("job_id", text(entry.getJobId()));
    values.put("technician_id", text(entry.getTechnicianId()));
    values.put("date_worked", text(entry.getDateWorked()));
    values.put("time_in", text(entry.getTimeIn()));
    values.put("time_out", text(entry.getTimeOut()));
    values.put("hours_worked", text(entry.getHoursWorked()));
    values.put("mileage", text(entry.getMileage()));
    values.put("per_diem", text(entry.getPerDiem()));
    values.put("personal_expenses", text(entry.getPersonalExpenses()));
    values.put("status", entry.getStatus().name());
    return values;
  }

  private static Map<String, Object> delta(Map<String, String> before, Map<String, String> after) {
    var details = new LinkedHashMap<String, Object>();
    for (var key : before.keySet()) {
      if (!Objects.equals(before.get(key), after.get(key))) {
        details.put(key, Map.of("from", before.get(key), "to", after.get(key)));
      }
    }
    return details;
  }

  private static String text(Object value) {
    return value != null ? value.toString() : "";
  }
}
