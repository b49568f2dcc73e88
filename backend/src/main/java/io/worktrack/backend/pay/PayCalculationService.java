package io.worktrack.backend.pay;

import io.worktrack.backend.exception.ResourceNotFoundException;
import io.worktrack.backend.job.Job;
import io.worktrack.backend.job.JobRepository;
import io.worktrack.backend.mileagerate.MileageRateService;
import io.worktrack.backend.mileagerate.MileageRateTable;
import io.worktrack.backend.technician.Technician;
import io.worktrack.backend.technician.TechnicianRepository;
import io.worktrack.backend.timeentry.TimeEntry;
import io.worktrack.backend.timeentry.TimeEntryRepository;
import io.worktrack.backend.timeentry.TimeEntryStatus;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads a job's payable entries, technicians and mileage rates and runs {@link PayCalculator}.
 * Results are never cached: entries and rates can change between calls.
 */
@Service
public class PayCalculationService {

  private final JobRepository jobRepository;
  private final TimeEntryRepository timeEntryRepository;
  private final TechnicianRepository technicianRepository;
  private final MileageRateService mileageRateService;
  private final PayCalculator payCalculator;

  public PayCalculationService(
      JobRepository jobRepository,
      TimeEntryRepository timeEntryRepository,
      TechnicianRepository technicianRepository,
      MileageRateService mileageRateService,
      PayCalculator payCalculator) {
    this.jobRepository = jobRepository;
    this.timeEntryRepository = timeEntryRepository;
    this.technicianRepository = technicianRepository;
    this.mileageRateService = mileageRateService;
    this.payCalculator = payCalculator;
  }

  @Transactional(readOnly = true)
  public JobPayCalculation calculateJobPay(UUID jobId) {
    var job =
        jobRepository
            .findById(jobId)
            .orElseThrow(() -> new ResourceNotFoundException("Job", jobId));
    return calculate(job, mileageRateService.rateTable());
  }

  /**
   * Calculates pay for an already loaded job against a shared rate snapshot. Runs in the caller's
   * transaction so that an {@link io.worktrack.backend.exception.IncompleteJobDataException} for
   * one job does not mark a whole report's transaction rollback-only.
   */
  public JobPayCalculation calculate(Job job, MileageRateTable mileageRates) {
    var entries = timeEntryRepository.findByJobIdAndStatusIn(job.getId(), TimeEntryStatus.PAYABLE);
    var technicianIds =
        entries.stream()
            .map(TimeEntry::getTechnicianId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
    Map<UUID, Technician> technicians =
        technicianIds.isEmpty()
            ? Map.of()
            : technicianRepository.findByIdIn(technicianIds).stream()
                .collect(Collectors.toMap(Technician::getId, Function.identity()));
    return payCalculator.calculate(job, entries, technicians, mileageRates);
  }
}
