package io.worktrack.backend.timeentry;

import io.worktrack.backend.exception.InvalidTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Hours a technician logged against a job. {@code technicianId} is null for imported entries
 * awaiting assignment. Every status change goes through one of the transition methods, which
 * check the current status; {@code version} makes a concurrent change fail at flush time.
 */
@Entity
@Table(name = "time_entries")
public class TimeEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "job_id", nullable = false)
  private UUID jobId;

  @Column(name = "technician_id")
  private UUID technicianId;

  @Column(name = "pay_period_id")
  private UUID payPeriodId;

  @Column(name = "date_worked", nullable = false)
  private LocalDate dateWorked;

  @Column(name = "time_in")
  private LocalTime timeIn;

  @Column(name = "time_out")
  private LocalTime timeOut;

  @Column(name = "hours_worked", precision = 8, scale = 2)
  private BigDecimal hoursWorked;

  @Column(name = "mileage", nullable = false, precision = 10, scale = 2)
  private BigDecimal mileage;

  @Column(name = "per_diem", nullable = false, precision = 10, scale = 2)
  private BigDecimal perDiem;

  @Column(name = "personal_expenses", nullable = false, precision = 10, scale = 2)
  private BigDecimal personalExpenses;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TimeEntryStatus status;

  @Column(name = "rejection_reason", columnDefinition = "TEXT")
  private String rejectionReason;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "verified_by")
  private UUID verifiedBy;

  @Column(name = "verified_at")
  private Instant verifiedAt;

  @Column(name = "created_by", nullable = false, updatable = false)
  private UUID createdBy;

  @Column(name = "updated_by")
  private UUID updatedBy;

  @Version private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TimeEntry() {}

  public TimeEntry(UUID jobId, UUID technicianId, LocalDate dateWorked, UUID createdBy) {
    this.jobId = jobId;
    this.technicianId = technicianId;
    this.dateWorked = dateWorked;
    this.mileage = BigDecimal.ZERO;
    this.perDiem = BigDecimal.ZERO;
    this.personalExpenses = BigDecimal.ZERO;
    this.status = TimeEntryStatus.DRAFT;
    this.createdBy = createdBy;
    this.updatedBy = createdBy;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Sets clock times and hours together; hours follow {@link HoursCalculator#resolveHours}. */
  public void recordTime(LocalTime timeIn, LocalTime timeOut, BigDecimal explicitHours) {
    this.timeIn = timeIn;
    this.timeOut = timeOut;
    this.hoursWorked = HoursCalculator.resolveHours(explicitHours, timeIn, timeOut);
  }

  public void recordAmounts(BigDecimal mileage, BigDecimal perDiem, BigDecimal personalExpenses) {
    this.mileage = mileage != null ? mileage : BigDecimal.ZERO;
    this.perDiem = perDiem != null ? perDiem : BigDecimal.ZERO;
    this.personalExpenses = personalExpenses != null ? personalExpenses : BigDecimal.ZERO;
  }

  public void reschedule(UUID jobId, LocalDate dateWorked) {
    this.jobId = jobId;
    this.dateWorked = dateWorked;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }

  public void assignTechnician(UUID technicianId, UUID actorId) {
    this.technicianId = technicianId;
    touch(actorId);
  }

  public void attachToPayPeriod(UUID payPeriodId) {
    this.payPeriodId = payPeriodId;
  }

  public void touch(UUID actorId) {
    this.updatedBy = actorId;
    this.updatedAt = Instant.now();
  }

  public boolean isAssigned() {
    return technicianId != null;
  }

  public boolean hasHours() {
    return hoursWorked != null && hoursWorked.signum() > 0;
  }

  public void submit(UUID actorId) {
    requireTransition(TimeEntryStatus.SUBMITTED);
    this.status = TimeEntryStatus.SUBMITTED;
    this.rejectionReason = null;
    touch(actorId);
  }

  public void verify(UUID actorId) {
    requireTransition(TimeEntryStatus.VERIFIED);
    this.status = TimeEntryStatus.VERIFIED;
    this.verifiedBy = actorId;
    this.verifiedAt = Instant.now();
    touch(actorId);
  }

  /** Returns a submitted entry to draft with the manager's reason attached. */
  public void reject(String reason, UUID actorId) {
    if (status != TimeEntryStatus.SUBMITTED) {
      throw new InvalidTransitionException(
          "Time entry " + id + " cannot be rejected from status " + status);
    }
    this.status = TimeEntryStatus.DRAFT;
    this.rejectionReason = reason;
    touch(actorId);
  }

  public void markBilled(UUID actorId) {
    requireTransition(TimeEntryStatus.BILLED);
    this.status = TimeEntryStatus.BILLED;
    touch(actorId);
  }

  public void markPaid(UUID actorId) {
    requireTransition(TimeEntryStatus.PAID);
    this.status = TimeEntryStatus.PAID;
    touch(actorId);
  }

  private void requireTransition(TimeEntryStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidTransitionException(
          "Time entry " + id + " cannot move from " + status + " to " + target);
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getJobId() {
    return jobId;
  }

  public UUID getTechnicianId() {
    return technicianId;
  }

  public UUID getPayPeriodId() {
    return payPeriodId;
  }

  public LocalDate getDateWorked() {
    return dateWorked;
  }

  public LocalTime getTimeIn() {
    return timeIn;
  }

  public LocalTime getTimeOut() {
    return timeOut;
  }

  public BigDecimal getHoursWorked() {
    return hoursWorked;
  }

  public BigDecimal getMileage() {
    return mileage;
  }

  public BigDecimal getPerDiem() {
    return perDiem;
  }

  public BigDecimal getPersonalExpenses() {
    return personalExpenses;
  }

  public TimeEntryStatus getStatus() {
    return status;
  }

  public String getRejectionReason() {
    return rejectionReason;
  }

  public String getNotes() {
    return notes;
  }

  public UUID getVerifiedBy() {
    return verifiedBy;
  }

  public Instant getVerifiedAt() {
    return verifiedAt;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public UUID getUpdatedBy() {
    return updatedBy;
  }

  public Long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
