package io.worktrack.backend.job;

import io.worktrack.backend.audit.AuditEventBuilder;
import io.worktrack.backend.audit.AuditService;
import io.worktrack.backend.exception.InvalidStateException;
import io.worktrack.backend.exception.ResourceNotFoundException;
import io.worktrack.backend.platform.PlatformRepository;
import io.worktrack.backend.security.AccessGuard;
import io.worktrack.backend.security.ActingUser;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class JobService {

  private static final Logger log = LoggerFactory.getLogger(JobService.class);

  private final JobRepository jobRepository;
  private final PlatformRepository platformRepository;
  private final AuditService auditService;

  public JobService(
      JobRepository jobRepository,
      PlatformRepository platformRepository,
      AuditService auditService) {
    this.jobRepository = jobRepository;
    this.platformRepository = platformRepository;
    this.auditService = auditService;
  }

  @Transactional
  public Job createJob(
      UUID platformId,
      String ticketNumber,
      String description,
      BillingType billingType,
      BigDecimal billingAmount,
      LocalDate jobDate,
      String externalUrl,
      ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "create jobs");
    if (!platformRepository.existsById(platformId)) {
      throw new ResourceNotFoundException("Platform", platformId);
    }
    if (description == null || description.isBlank()) {
      throw new InvalidStateException("Invalid job", "Job description is required");
    }
    requireNonNegative("billing amount", billingAmount);

    var job = new Job(platformId, ticketNumber, description, billingType, billingAmount, jobDate);
    job.setExternalUrl(externalUrl);
    job = jobRepository.save(job);
    log.info("Created job {} ({}) on platform {}", job.getId(), ticketNumber, platformId);

    var details = new LinkedHashMap<String, Object>();
    details.put("ticket_number", ticketNumber != null ? ticketNumber : "");
    details.put("billing_type", job.getBillingType().name());
    details.put("billing_amount", billingAmount != null ? billingAmount.toString() : "");
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("job.created")
            .entityType("job")
            .entityId(job.getId())
            .actor(actor)
            .details(details)
            .build());
    return job;
  }

  /**
   * Replaces the job's billing amount, expenses and commissions. Null expenses/commissions are
   * stored as zero; a null billing amount takes the job back out of pay calculation.
   */
  @Transactional
  public Job updateFinancials(
      UUID jobId,
      BigDecimal billingAmount,
      BigDecimal expenses,
      BigDecimal commissions,
      ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "change job financials");
    requireNonNegative("billing amount", billingAmount);
    requireNonNegative("expenses", expenses);
    requireNonNegative("commissions", commissions);
    var job = requireJob(jobId);

    var before = financials(job);
    job.updateFinancials(billingAmount, expenses, commissions);
    job = jobRepository.save(job);
    var after = financials(job);
    log.info("Updated financials of job {}", jobId);

    var details = new LinkedHashMap<String, Object>();
    for (var key : before.keySet()) {
      if (!Objects.equals(before.get(key), after.get(key))) {
        details.put(key, Map.of("from", before.get(key), "to", after.get(key)));
      }
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("job.updated")
            .entityType("job")
            .entityId(jobId)
            .actor(actor)
            .details(details)
            .build());
    return job;
  }

  @Transactional
  public Job changeStatus(UUID jobId, JobStatus target, ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "change job status");
    var job = requireJob(jobId);
    var current = job.getJobStatus();
    if (current == target) {
      return job;
    }
    if (!current.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid job status", "Cannot move job from " + current + " to " + target);
    }
    job.changeStatus(target);
    job = jobRepository.save(job);
    log.info("Job {} status changed from {} to {}", jobId, current, target);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("job.status_changed")
            .entityType("job")
            .entityId(jobId)
            .actor(actor)
            .details(Map.of("job_status", Map.of("from", current.name(), "to", target.name())))
            .build());
    return job;
  }

  @Transactional(readOnly = true)
  public Job requireJob(UUID jobId) {
    return jobRepository
        .findById(jobId)
        .orElseThrow(() -> new ResourceNotFoundException("Job", jobId));
  }

  private static Map<String, String> financials(Job job) {
    var values = new LinkedHashMap<String, String>();
    values.put(
        "billing_amount", job.getBillingAmount() != null ? job.getBillingAmount().toString() : "");
    values.put("expenses", job.getExpenses().toString());
    values.put("commissions", job.getCommissions().toString());
    return values;
  }

  private static void requireNonNegative(String field, BigDecimal value) {
    if (value != null && value.signum() < 0) {
      throw new InvalidStateException("Invalid " + field, "The " + field + " cannot be negative");
    }
  }
}
