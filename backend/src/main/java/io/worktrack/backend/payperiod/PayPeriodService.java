package io.worktrack.backend.payperiod;

import io.worktrack.backend.audit.AuditEventBuilder;
import io.worktrack.backend.audit.AuditService;
import io.worktrack.backend.exception.InvalidStateException;
import io.worktrack.backend.exception.ResourceConflictException;
import io.worktrack.backend.exception.ResourceNotFoundException;
import io.worktrack.backend.payroll.PayrollReport;
import io.worktrack.backend.payroll.PayrollReportService;
import io.worktrack.backend.security.AccessGuard;
import io.worktrack.backend.security.ActingUser;
import io.worktrack.backend.timeentry.TimeEntry;
import io.worktrack.backend.timeentry.TimeEntryRepository;
import io.worktrack.backend.timeentry.TimeEntryStatus;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PayPeriodService {

  private static final Logger log = LoggerFactory.getLogger(PayPeriodService.class);

  private final PayPeriodRepository payPeriodRepository;
  private final TimeEntryRepository timeEntryRepository;
  private final PayrollReportService payrollReportService;
  private final AuditService auditService;

  public PayPeriodService(
      PayPeriodRepository payPeriodRepository,
      TimeEntryRepository timeEntryRepository,
      PayrollReportService payrollReportService,
      AuditService auditService) {
    this.payPeriodRepository = payPeriodRepository;
    this.timeEntryRepository = timeEntryRepository;
    this.payrollReportService = payrollReportService;
    this.auditService = auditService;
  }

  /** Opens a period and attaches the entries in its range that have no period yet. */
  @Transactional
  public PayPeriod createPayPeriod(
      LocalDate startDate, LocalDate endDate, String name, ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "create pay periods");
    if (startDate == null || endDate == null) {
      throw new InvalidStateException("Invalid pay period", "Start and end dates are required");
    }
    if (endDate.isBefore(startDate)) {
      throw new InvalidStateException(
          "Invalid pay period", "End date " + endDate + " is before start date " + startDate);
    }
    var overlapping = payPeriodRepository.findOverlapping(startDate, endDate);
    if (!overlapping.isEmpty()) {
      var existing = overlapping.get(0);
      throw new ResourceConflictException(
          "pay period",
          existing.getId(),
          "Pay period "
              + existing.getStartDate()
              + " to "
              + existing.getEndDate()
              + " overlaps the requested range");
    }

    var label = name != null && !name.isBlank() ? name.trim() : startDate + " - " + endDate;
    var period = payPeriodRepository.save(new PayPeriod(label, startDate, endDate));
    var unperioded = timeEntryRepository.findUnperiodedInRange(startDate, endDate);
    for (var entry : unperioded) {
      entry.attachToPayPeriod(period.getId());
    }
    timeEntryRepository.saveAll(unperioded);
    log.info(
        "Created pay period {} ({} to {}), attached {} entries",
        period.getId(),
        startDate,
        endDate,
        unperioded.size());

    var details = new LinkedHashMap<String, Object>();
    details.put("name", label);
    details.put("start_date", startDate.toString());
    details.put("end_date", endDate.toString());
    details.put("attached_entries", unperioded.size());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("pay_period.created")
            .entityType("pay_period")
            .entityId(period.getId())
            .actor(actor)
            .details(details)
            .build());
    return period;
  }

  /**
   * Closes an open period once every entry in it is verified, billed or paid, and records the
   * period's payable hours.
   */
  @Transactional
  public PayPeriod closePayPeriod(UUID periodId, ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "close pay periods");
    var period = requirePeriod(periodId);
    if (!period.isOpen()) {
      throw new InvalidStateException(
          "Invalid pay period status", "Only open pay periods can be closed");
    }
    long pending =
        timeEntryRepository.countByPayPeriodIdAndStatusIn(periodId, TimeEntryStatus.PENDING);
    if (pending > 0) {
      throw new InvalidStateException(
          "Pay period has pending entries",
          pending + " time entries are still draft or submitted; verify or reject them first");
    }

    var totalHours =
        timeEntryRepository.findByPayPeriodId(periodId).stream()
            .filter(entry -> entry.getStatus().isPayable())
            .map(TimeEntry::getHoursWorked)
            .filter(Objects::nonNull)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    period.close(totalHours, actor.userId());
    period = payPeriodRepository.saveAndFlush(period);
    log.info("Closed pay period {} with {} payable hours", periodId, totalHours);

    var details = new LinkedHashMap<String, Object>();
    details.put("status", Map.of("from", "OPEN", "to", "CLOSED"));
    details.put("total_hours", totalHours.toString());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("pay_period.closed")
            .entityType("pay_period")
            .entityId(periodId)
            .actor(actor)
            .details(details)
            .build());
    return period;
  }

  @Transactional
  public PayPeriod archivePayPeriod(UUID periodId, ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "archive pay periods");
    var period = requirePeriod(periodId);
    period.archive();
    period = payPeriodRepository.save(period);
    log.info("Archived pay period {}", periodId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("pay_period.archived")
            .entityType("pay_period")
            .entityId(periodId)
            .actor(actor)
            .details(Map.of("status", Map.of("from", "CLOSED", "to", "ARCHIVED")))
            .build());
    return period;
  }

  @Transactional(readOnly = true)
  public PayrollReport payrollReportForPeriod(UUID periodId, ActingUser actor) {
    var period = requirePeriod(periodId);
    return payrollReportService.payrollReport(
        period.getStartDate(), period.getEndDate(), null, actor);
  }

  @Transactional(readOnly = true)
  public Optional<PayPeriod> findOpenPeriodFor(LocalDate date) {
    return payPeriodRepository.findOpenContaining(date);
  }

  @Transactional(readOnly = true)
  public List<PayPeriod> listPayPeriods() {
    return payPeriodRepository.findAllByOrderByStartDateDesc();
  }

  @Transactional(readOnly = true)
  public PayPeriod requirePeriod(UUID periodId) {
    return payPeriodRepository
        .findById(periodId)
        .orElseThrow(() -> new ResourceNotFoundException("PayPeriod", periodId));
  }
}
