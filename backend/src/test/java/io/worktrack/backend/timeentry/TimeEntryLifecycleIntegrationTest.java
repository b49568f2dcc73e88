package io.worktrack.backend.timeentry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.worktrack.backend.TestcontainersConfiguration;
import io.worktrack.backend.audit.AuditEvent;
import io.worktrack.backend.audit.AuditEventRepository;
import io.worktrack.backend.exception.InvalidStateException;
import io.worktrack.backend.exception.InvalidTransitionException;
import io.worktrack.backend.exception.MissingAssignmentException;
import io.worktrack.backend.job.BillingType;
import io.worktrack.backend.job.Job;
import io.worktrack.backend.job.JobService;
import io.worktrack.backend.mileagerate.MileageRateService;
import io.worktrack.backend.pay.PayCalculationService;
import io.worktrack.backend.payperiod.PayPeriodService;
import io.worktrack.backend.payperiod.PayPeriodStatus;
import io.worktrack.backend.payroll.PayrollReportService;
import io.worktrack.backend.platform.Platform;
import io.worktrack.backend.platform.PlatformRepository;
import io.worktrack.backend.security.ActingUser;
import io.worktrack.backend.technician.Technician;
import io.worktrack.backend.technician.TechnicianService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the time entry lifecycle against PostgreSQL: submit and verify, concurrent transitions,
 * pay period close and payroll.
 */
@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TimeEntryLifecycleIntegrationTest {

  @Autowired private TimeEntryService timeEntryService;
  @Autowired private JobService jobService;
  @Autowired private TechnicianService technicianService;
  @Autowired private PlatformRepository platformRepository;
  @Autowired private MileageRateService mileageRateService;
  @Autowired private PayPeriodService payPeriodService;
  @Autowired private PayrollReportService payrollReportService;
  @Autowired private PayCalculationService payCalculationService;
  @Autowired private AuditEventRepository auditEventRepository;

  private final ActingUser admin = ActingUser.admin(UUID.randomUUID());
  private final ActingUser manager = ActingUser.manager(UUID.randomUUID());

  private Platform platform;
  private Technician ana;
  private ActingUser anaUser;

  @BeforeAll
  void seed() {
    platform = platformRepository.save(new Platform("Field Nation", "FN-IT"));
    ana =
        technicianService.createTechnician(
            "Ana Reyes", "ana@example.com", null, new BigDecimal("20"), manager);
    anaUser = ActingUser.technician(UUID.randomUUID(), ana.getId());
    mileageRateService.createMileageRate(
        new BigDecimal("0.70"), LocalDate.of(2030, 1, 1), "Test rate", admin);
  }

  @Test
  void entryMovesFromDraftToVerifiedAndIsAudited() {
    var job = newJob("1000", "100", LocalDate.of(2031, 1, 6));
    var entry = logHours(job, LocalDate.of(2031, 1, 6), "4");

    timeEntryService.submit(entry.getId(), anaUser);
    var verified = timeEntryService.verify(entry.getId(), manager);

    assertThat(verified.getStatus()).isEqualTo(TimeEntryStatus.VERIFIED);
    assertThat(verified.getVerifiedBy()).isEqualTo(manager.userId());
    assertThat(auditEventRepository.findByEntityIdOrderByOccurredAtAsc(entry.getId()))
        .extracting(AuditEvent::getEventType)
        .containsExactly("time_entry.created", "time_entry.submitted", "time_entry.verified");
  }

  @Test
  void unassignedEntryCannotBeSubmittedUntilAssigned() {
    var job = newJob("500", "0", LocalDate.of(2031, 2, 3));
    var entry =
        timeEntryService.createTimeEntry(
            TimeEntryInput.ofHours(
                job.getId(), null, LocalDate.of(2031, 2, 3), new BigDecimal("2")),
            manager);

    assertThatThrownBy(() -> timeEntryService.submit(entry.getId(), manager))
        .isInstanceOf(MissingAssignmentException.class);

    timeEntryService.assignTechnician(entry.getId(), ana.getId(), manager);
    var submitted = timeEntryService.submit(entry.getId(), manager);
    assertThat(submitted.getStatus()).isEqualTo(TimeEntryStatus.SUBMITTED);
  }

  @Test
  void concurrentVerificationsSucceedExactlyOnce() throws Exception {
    var job = newJob("800", "0", LocalDate.of(2031, 3, 3));
    var entry = logHours(job, LocalDate.of(2031, 3, 3), "5");
    timeEntryService.submit(entry.getId(), anaUser);

    var start = new CountDownLatch(1);
    var executor = Executors.newFixedThreadPool(2);
    try {
      Callable<TimeEntry> verify =
          () -> {
            start.await();
            return timeEntryService.verify(entry.getId(), manager);
          };
      var futures = List.of(executor.submit(verify), executor.submit(verify));
      start.countDown();

      int succeeded = 0;
      var failures = new ArrayList<Throwable>();
      for (Future<TimeEntry> future : futures) {
        try {
          future.get();
          succeeded++;
        } catch (ExecutionException e) {
          failures.add(e.getCause());
        }
      }

      assertThat(succeeded).isEqualTo(1);
      assertThat(failures).singleElement().isInstanceOf(InvalidTransitionException.class);
    } finally {
      executor.shutdownNow();
    }
    assertThat(timeEntryService.requireEntry(entry.getId()).getStatus())
        .isEqualTo(TimeEntryStatus.VERIFIED);
  }

  @Test
  void submitRacingRejectEndsInAStateOneOfThemProduced() throws Exception {
    var job = newJob("700", "0", LocalDate.of(2031, 3, 10));
    var entry = logHours(job, LocalDate.of(2031, 3, 10), "3");
    timeEntryService.submit(entry.getId(), anaUser);

    var start = new CountDownLatch(1);
    var executor = Executors.newFixedThreadPool(2);
    Throwable submitFailure = null;
    Throwable rejectFailure = null;
    try {
      Future<TimeEntry> resubmit =
          executor.submit(
              () -> {
                start.await();
                return timeEntryService.submit(entry.getId(), anaUser);
              });
      Future<TimeEntry> reject =
          executor.submit(
              () -> {
                start.await();
                return timeEntryService.reject(entry.getId(), "Split across two days", manager);
              });
      start.countDown();

      try {
        resubmit.get();
      } catch (ExecutionException e) {
        submitFailure = e.getCause();
      }
      try {
        reject.get();
      } catch (ExecutionException e) {
        rejectFailure = e.getCause();
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(rejectFailure).isNull();
    var stored = timeEntryService.requireEntry(entry.getId());
    if (submitFailure != null) {
      assertThat(submitFailure).isInstanceOf(InvalidTransitionException.class);
      assertThat(stored.getStatus()).isEqualTo(TimeEntryStatus.DRAFT);
      assertThat(stored.getRejectionReason()).isEqualTo("Split across two days");
    } else {
      assertThat(stored.getStatus()).isEqualTo(TimeEntryStatus.SUBMITTED);
      assertThat(stored.getRejectionReason()).isNull();
    }
  }

  @Test
  void bulkVerifyContinuesPastEntriesInTheWrongState() {
    var job = newJob("600", "0", LocalDate.of(2031, 4, 7));
    var ids = new ArrayList<UUID>();
    for (int i = 0; i < 5; i++) {
      var entry = logHours(job, LocalDate.of(2031, 4, 7 + i), "1");
      if (i % 2 == 0) {
        timeEntryService.submit(entry.getId(), anaUser);
      }
      ids.add(entry.getId());
    }

    var result = timeEntryService.bulkVerify(ids, manager);

    assertThat(result.successCount()).isEqualTo(3);
    assertThat(result.failed())
        .extracting(TransitionFailure::entryId)
        .containsExactly(ids.get(1), ids.get(3));
  }

  @Test
  void payPeriodClosesOnceEveryEntryIsVerified() {
    var job = newJob("400", "0", LocalDate.of(2031, 5, 5));
    var early = logHours(job, LocalDate.of(2031, 5, 5), "3");
    var period =
        payPeriodService.createPayPeriod(
            LocalDate.of(2031, 5, 1), LocalDate.of(2031, 5, 15), "May A", manager);
    var late = logHours(job, LocalDate.of(2031, 5, 12), "2.5");

    assertThat(timeEntryService.requireEntry(early.getId()).getPayPeriodId())
        .isEqualTo(period.getId());
    assertThat(late.getPayPeriodId()).isEqualTo(period.getId());
    assertThatThrownBy(() -> payPeriodService.closePayPeriod(period.getId(), manager))
        .isInstanceOf(InvalidStateException.class);

    for (var entry : List.of(early, late)) {
      timeEntryService.submit(entry.getId(), anaUser);
      timeEntryService.verify(entry.getId(), manager);
    }
    var closed = payPeriodService.closePayPeriod(period.getId(), manager);

    assertThat(closed.getStatus()).isEqualTo(PayPeriodStatus.CLOSED);
    assertThat(closed.getTotalHours()).isEqualByComparingTo("5.5");
  }

  @Test
  void payrollIncludesBasePayAndMileage() {
    var job = newJob("1000", "100", LocalDate.of(2031, 6, 2));
    var entry =
        timeEntryService.createTimeEntry(
            new TimeEntryInput(
                job.getId(),
                null,
                LocalDate.of(2031, 6, 2),
                null,
                null,
                new BigDecimal("10"),
                new BigDecimal("10"),
                null,
                null,
                null),
            anaUser);
    timeEntryService.submit(entry.getId(), anaUser);
    timeEntryService.verify(entry.getId(), manager);

    var calculation = payCalculationService.calculateJobPay(job.getId());
    var report =
        payrollReportService.payrollReport(
            LocalDate.of(2031, 6, 1), LocalDate.of(2031, 6, 30), ana.getId(), anaUser);

    assertThat(calculation.totalBasePay()).isEqualByComparingTo("450");
    assertThat(report.technicians()).hasSize(1);
    var line = report.technicians().get(0).jobs().get(0);
    assertThat(line.basePay()).isEqualByComparingTo("450");
    assertThat(line.mileagePay()).isEqualByComparingTo("7.00");
    assertThat(line.totalPay()).isEqualByComparingTo("457.00");
    assertThat(report.grandTotals().totalPay()).isEqualByComparingTo("457.00");
  }

  private Job newJob(String billing, String expenses, LocalDate date) {
    var job =
        jobService.createJob(
            platform.getId(),
            "IT-" + UUID.randomUUID().toString().substring(0, 8),
            "Integration job",
            BillingType.FLAT_RATE,
            new BigDecimal(billing),
            date,
            null,
            manager);
    return jobService.updateFinancials(
        job.getId(), new BigDecimal(billing), new BigDecimal(expenses), null, manager);
  }

  private TimeEntry logHours(Job job, LocalDate date, String hours) {
    return timeEntryService.createTimeEntry(
        TimeEntryInput.ofHours(job.getId(), ana.getId(), date, new BigDecimal(hours)), anaUser);
  }
}
