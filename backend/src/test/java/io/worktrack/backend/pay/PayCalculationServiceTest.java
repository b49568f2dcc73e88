package io.worktrack.backend.pay;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.worktrack.backend.exception.ResourceNotFoundException;
import io.worktrack.backend.job.JobRepository;
import io.worktrack.backend.mileagerate.MileageRateService;
import io.worktrack.backend.mileagerate.MileageRateTable;
import io.worktrack.backend.technician.TechnicianRepository;
import io.worktrack.backend.testutil.TestEntities;
import io.worktrack.backend.timeentry.TimeEntryRepository;
import io.worktrack.backend.timeentry.TimeEntryStatus;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PayCalculationServiceTest {

  @Mock private JobRepository jobRepository;
  @Mock private TimeEntryRepository timeEntryRepository;
  @Mock private TechnicianRepository technicianRepository;
  @Mock private MileageRateService mileageRateService;

  private PayCalculationService service;

  @BeforeEach
  void setUp() {
    service =
        new PayCalculationService(
            jobRepository,
            timeEntryRepository,
            technicianRepository,
            mileageRateService,
            new PayCalculator(PayrollProperties.defaults()));
  }

  @Test
  void loadsPayableEntriesAndTheirTechnicians() {
    var job = TestEntities.job("1000", "100", "0");
    var ana = TestEntities.technician("Ana", "20");
    var entry = TestEntities.verified(job, ana, LocalDate.of(2026, 1, 5), "10");
    when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
    when(mileageRateService.rateTable()).thenReturn(MileageRateTable.empty());
    when(timeEntryRepository.findByJobIdAndStatusIn(job.getId(), TimeEntryStatus.PAYABLE))
        .thenReturn(List.of(entry));
    when(technicianRepository.findByIdIn(anyCollection())).thenReturn(List.of(ana));

    var result = service.calculateJobPay(job.getId());

    assertThat(result.forTechnician(ana.getId()).orElseThrow().basePay())
        .isEqualByComparingTo("450");
    assertThat(result.forTechnician(ana.getId()).orElseThrow().technicianName())
        .isEqualTo("Ana");
  }

  @Test
  void skipsTechnicianLookupWhenNoEntryIsAssigned() {
    var job = TestEntities.job("1000", "0", "0");
    when(timeEntryRepository.findByJobIdAndStatusIn(job.getId(), TimeEntryStatus.PAYABLE))
        .thenReturn(List.of());

    var result = service.calculate(job, MileageRateTable.empty());

    assertThat(result.status()).isEqualTo(JobPayStatus.NO_PAYABLE_HOURS);
    verify(technicianRepository, never()).findByIdIn(anyCollection());
  }

  @Test
  void unknownJobIsNotFound() {
    var id = UUID.randomUUID();
    when(jobRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.calculateJobPay(id))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
