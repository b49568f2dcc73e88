package io.worktrack.backend.payroll;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import io.worktrack.backend.exception.InvalidStateException;
import io.worktrack.backend.exception.PermissionDeniedException;
import io.worktrack.backend.job.Job;
import io.worktrack.backend.job.JobRepository;
import io.worktrack.backend.job.JobStatus;
import io.worktrack.backend.mileagerate.MileageRateService;
import io.worktrack.backend.mileagerate.MileageRateTable;
import io.worktrack.backend.pay.PayCalculationService;
import io.worktrack.backend.pay.PayCalculator;
import io.worktrack.backend.pay.PayrollProperties;
import io.worktrack.backend.platform.PlatformRepository;
import io.worktrack.backend.security.ActingUser;
import io.worktrack.backend.technician.Technician;
import io.worktrack.backend.technician.TechnicianRepository;
import io.worktrack.backend.technician.TechnicianService;
import io.worktrack.backend.testutil.TestEntities;
import io.worktrack.backend.timeentry.TimeEntry;
import io.worktrack.backend.timeentry.TimeEntryRepository;
import io.worktrack.backend.timeentry.TimeEntryStatus;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PayrollReportServiceTest {

  private static final LocalDate FROM = LocalDate.of(2026, 1, 1);
  private static final LocalDate TO = LocalDate.of(2026, 1, 15);

  @Mock private TimeEntryRepository timeEntryRepository;
  @Mock private JobRepository jobRepository;
  @Mock private TechnicianRepository technicianRepository;
  @Mock private PlatformRepository platformRepository;
  @Mock private TechnicianService technicianService;
  @Mock private MileageRateService mileageRateService;

  private PayrollReportService service;
  private final ActingUser manager = ActingUser.manager(UUID.randomUUID());

  private Technician ana;
  private Technician ben;
  private Job wellPaid;
  private Job smallJob;
  private Job unbilled;
  private final List<TimeEntry> allEntries = new ArrayList<>();

  @BeforeEach
  void setUp() {
    var payCalculationService =
        new PayCalculationService(
            jobRepository,
            timeEntryRepository,
            technicianRepository,
            mileageRateService,
            new PayCalculator(PayrollProperties.defaults()));
    service =
        new PayrollReportService(
            timeEntryRepository,
            jobRepository,
            technicianRepository,
            platformRepository,
            technicianService,
            mileageRateService,
            payCalculationService);

    ana = TestEntities.technician("Ana", "20");
    ben = TestEntities.technician("ben", "60");
    wellPaid = TestEntities.job("1000", "100", "0");
    smallJob = TestEntities.job("500", "0", "0");
    unbilled = TestEntities.job(null, "0", "0");
  }

  @Nested
  class Payroll {

    @BeforeEach
    void entries() {
      payable(wellPaid, TestEntities.verified(wellPaid, ana, day(5), "8"));
      payable(wellPaid, TestEntities.verified(wellPaid, ben, day(6), "2"));
      payable(smallJob, TestEntities.verified(smallJob, ana, day(8), "2.5"));
      payable(smallJob, TestEntities.verified(smallJob, ana, day(7), "2.5"));
      payable(unbilled, TestEntities.verified(unbilled, ben, day(9), "3"));
      lenient()
          .when(
              timeEntryRepository.findByStatusInAndDateRange(TimeEntryStatus.PAYABLE, FROM, TO))
          .thenReturn(allEntries);
      lenient()
          .when(jobRepository.findByIdIn(anyCollection()))
          .thenReturn(List.of(wellPaid, smallJob, unbilled));
      lenient()
          .when(technicianRepository.findByIdIn(anyCollection()))
          .thenReturn(List.of(ana, ben));
      lenient().when(mileageRateService.rateTable()).thenReturn(MileageRateTable.empty());
    }

    @Test
    void grandTotalsAreTheSumOfTechnicianSubtotals() {
      var report = service.payrollReport(FROM, TO, null, manager);

      assertThat(report.technicians())
          .extracting(PayrollReport.TechnicianPayroll::technicianName)
          .containsExactly("Ana", "ben");
      var anaRow = report.technicians().get(0);
      var benRow = report.technicians().get(1);
      assertThat(anaRow.totals().basePay()).isEqualByComparingTo("610");
      assertThat(anaRow.totals().hours()).isEqualByComparingTo("13");
      assertThat(benRow.totals().basePay()).isEqualByComparingTo("120");
      assertThat(report.grandTotals().basePay()).isEqualByComparingTo("730");
      assertThat(report.grandTotals().totalPay())
          .isEqualByComparingTo(anaRow.totals().totalPay().add(benRow.totals().totalPay()));
    }

    @Test
    void jobThatCannotBeCalculatedBecomesAnIssue() {
      var report = service.payrollReport(FROM, TO, null, manager);

      assertThat(report.issues())
          .singleElement()
          .satisfies(
              issue -> {
                assertThat(issue.jobId()).isEqualTo(unbilled.getId());
                assertThat(issue.detail()).contains("no billing amount");
              });
      var benRow = report.technicians().get(1);
      assertThat(benRow.jobs())
          .extracting(PayrollReport.JobLine::jobId)
          .containsExactly(wellPaid.getId());
    }

    @Test
    void technicianWithoutARecordIsReportedAsAnIssue() {
      when(technicianRepository.findByIdIn(anyCollection())).thenReturn(List.of(ana));

      var report = service.payrollReport(FROM, TO, null, manager);

      assertThat(report.technicians())
          .extracting(PayrollReport.TechnicianPayroll::technicianName)
          .containsExactly("Ana");
      assertThat(report.issues())
          .filteredOn(issue -> issue.detail().contains(ben.getId() + " not found"))
          .extracting(PayrollReport.Issue::jobId)
          .containsExactlyInAnyOrder(wellPaid.getId(), unbilled.getId());
    }

    @Test
    void jobLinesAreOrderedByFirstDateAndShowTheirDateSpan() {
      var report = service.payrollReport(FROM, TO, null, manager);

      var lines = report.technicians().get(0).jobs();
      assertThat(lines)
          .extracting(PayrollReport.JobLine::jobId)
          .containsExactly(wellPaid.getId(), smallJob.getId());
      assertThat(lines.get(0).dateDisplay()).isEqualTo("2026-01-05");
      assertThat(lines.get(1).dateDisplay()).isEqualTo("2026-01-07 - 2026-01-08");
      assertThat(lines.get(1).basePay()).isEqualByComparingTo("250");
    }

    @Test
    void technicianSeesOnlyTheirOwnPayroll() {
      var anaUser = ActingUser.technician(UUID.randomUUID(), ana.getId());

      var report = service.payrollReport(FROM, TO, ana.getId(), anaUser);

      assertThat(report.technicians()).hasSize(1);
      assertThat(report.technicians().get(0).technicianId()).isEqualTo(ana.getId());
      assertThat(report.issues()).isEmpty();
    }

    @Test
    void technicianCannotViewOthersOrEveryone() {
      var anaUser = ActingUser.technician(UUID.randomUUID(), ana.getId());

      assertThatThrownBy(() -> service.payrollReport(FROM, TO, ben.getId(), anaUser))
          .isInstanceOf(PermissionDeniedException.class);
      assertThatThrownBy(() -> service.payrollReport(FROM, TO, null, anaUser))
          .isInstanceOf(PermissionDeniedException.class);
    }
  }

  @Test
  void rangeMustBeOrdered() {
    assertThatThrownBy(() -> service.payrollReport(TO, FROM, null, manager))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void billingReportFiltersByPlatformAndSumsPayableHours() {
    when(jobRepository.findByJobDateBetweenOrderByJobDateDescTicketNumberAsc(FROM, TO))
        .thenReturn(List.of(wellPaid, smallJob, unbilled));
    when(timeEntryRepository.findByJobIdInAndStatusIn(
            anyCollection(), eq(TimeEntryStatus.PAYABLE)))
        .thenReturn(
            List.of(
                TestEntities.verified(wellPaid, ana, day(5), "8"),
                TestEntities.verified(wellPaid, ben, day(6), "2")));

    var report = service.jobBillingReport(FROM, TO, wellPaid.getPlatformId(), null, manager);

    assertThat(report.jobs())
        .singleElement()
        .satisfies(
            line -> {
              assertThat(line.jobNet()).isEqualByComparingTo("900");
              assertThat(line.payableHours()).isEqualByComparingTo("10");
              assertThat(line.entryCount()).isEqualTo(2);
            });
    assertThat(report.summary().totalBilling()).isEqualByComparingTo("1000");
    assertThat(report.summary().totalHours()).isEqualByComparingTo("10");
  }

  @Test
  void billingReportLeavesUnknownBillingOutOfTotals() {
    unbilled.changeStatus(JobStatus.COMPLETED);
    when(jobRepository.findByJobDateBetweenOrderByJobDateDescTicketNumberAsc(FROM, TO))
        .thenReturn(List.of(wellPaid, smallJob, unbilled));

    var report = service.jobBillingReport(FROM, TO, null, JobStatus.COMPLETED, manager);

    assertThat(report.jobs())
        .extracting(JobBillingReport.JobLine::jobId)
        .containsExactly(unbilled.getId());
    assertThat(report.jobs().get(0).jobNet()).isNull();
    assertThat(report.summary().totalBilling()).isEqualByComparingTo("0");
  }

  @Test
  void billingReportIsForManagers() {
    var anaUser = ActingUser.technician(UUID.randomUUID(), ana.getId());

    assertThatThrownBy(() -> service.jobBillingReport(FROM, TO, null, null, anaUser))
        .isInstanceOf(PermissionDeniedException.class);
  }

  @Test
  void hoursReportGroupsByWeekStartingMonday() {
    when(technicianService.requireTechnician(ana.getId())).thenReturn(ana);
    when(timeEntryRepository.findByTechnicianAndDateRange(ana.getId(), FROM, TO))
        .thenReturn(
            List.of(
                TestEntities.draft(wellPaid, ana, day(5), "2"),
                TestEntities.entry(wellPaid, ana, day(7), "3", TimeEntryStatus.SUBMITTED),
                TestEntities.verified(smallJob, ana, day(11), "4"),
                TestEntities.verified(smallJob, ana, day(12), "1")));

    var report = service.technicianHoursReport(ana.getId(), FROM, TO, HoursGrouping.WEEK, manager);

    assertThat(report.buckets())
        .extracting(TechnicianHoursReport.Bucket::label)
        .containsExactly("2026-01-05", "2026-01-12");
    assertThat(report.buckets().get(0).hours()).isEqualByComparingTo("9");
    assertThat(report.buckets().get(0).entryCount()).isEqualTo(3);
    assertThat(report.totalHours()).isEqualByComparingTo(new BigDecimal("10"));
  }

  @Test
  void hoursReportByJobIsLabelledWithTickets() {
    var anaUser = ActingUser.technician(UUID.randomUUID(), ana.getId());
    when(technicianService.requireTechnician(ana.getId())).thenReturn(ana);
    when(timeEntryRepository.findByTechnicianAndDateRange(ana.getId(), FROM, TO))
        .thenReturn(
            List.of(
                TestEntities.verified(wellPaid, ana, day(5), "2"),
                TestEntities.verified(smallJob, ana, day(6), "1.5"),
                TestEntities.verified(wellPaid, ana, day(7), "1")));
    when(jobRepository.findByIdIn(anyCollection())).thenReturn(List.of(wellPaid, smallJob));

    var report = service.technicianHoursReport(ana.getId(), FROM, TO, HoursGrouping.JOB, anaUser);

    assertThat(report.buckets())
        .extracting(TechnicianHoursReport.Bucket::label)
        .containsExactly(wellPaid.getTicketNumber(), smallJob.getTicketNumber());
    assertThat(report.buckets().get(0).hours()).isEqualByComparingTo("3");
  }

  private void payable(Job job, TimeEntry entry) {
    allEntries.add(entry);
    var forJob =
        allEntries.stream().filter(e -> e.getJobId().equals(job.getId())).toList();
    lenient()
        .when(timeEntryRepository.findByJobIdAndStatusIn(job.getId(), TimeEntryStatus.PAYABLE))
        .thenReturn(forJob);
  }

  private static LocalDate day(int dayOfMonth) {
    return LocalDate.of(2026, 1, dayOfMonth);
  }
}
