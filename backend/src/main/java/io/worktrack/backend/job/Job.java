package io.worktrack.backend.job;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A work order booked through a platform. {@code billingAmount} stays null until the platform's
 * payout is known; a job cannot enter pay calculation before it is set.
 */
@Entity
@Table(name = "jobs")
public class Job {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "platform_id", nullable = false)
  private UUID platformId;

  @Column(name = "platform_job_code", length = 50)
  private String platformJobCode;

  @Column(name = "ticket_number", length = 50)
  private String ticketNumber;

  @Column(name = "description", nullable = false, length = 500)
  private String description;

  @Column(name = "client_name", length = 200)
  private String clientName;

  @Enumerated(EnumType.STRING)
  @Column(name = "billing_type", nullable = false, length = 20)
  private BillingType billingType;

  @Column(name = "billing_amount", precision = 12, scale = 2)
  private BigDecimal billingAmount;

  @Column(name = "expenses", nullable = false, precision = 12, scale = 2)
  private BigDecimal expenses;

  @Column(name = "commissions", nullable = false, precision = 12, scale = 2)
  private BigDecimal commissions;

  @Enumerated(EnumType.STRING)
  @Column(name = "job_status", nullable = false, length = 20)
  private JobStatus jobStatus;

  @Column(name = "job_date")
  private LocalDate jobDate;

  @Column(name = "completed_date")
  private LocalDate completedDate;

  @Column(name = "external_url", length = 500)
  private String externalUrl;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Job() {}

  public Job(
      UUID platformId,
      String ticketNumber,
      String description,
      BillingType billingType,
      BigDecimal billingAmount,
      LocalDate jobDate) {
    this.platformId = platformId;
    this.ticketNumber = ticketNumber;
    this.description = description;
    this.billingType = billingType != null ? billingType : BillingType.FLAT_RATE;
    this.billingAmount = billingAmount;
    this.expenses = BigDecimal.ZERO;
    this.commissions = BigDecimal.ZERO;
    this.jobStatus = JobStatus.PENDING;
    this.jobDate = jobDate;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Billing amount minus expenses and commissions; null while the billing amount is unknown. */
  public BigDecimal getNetAmount() {
    if (billingAmount == null) {
      return null;
    }
    return billingAmount.subtract(expenses).subtract(commissions);
  }

  public boolean isCancelled() {
    return jobStatus == JobStatus.CANCELLED;
  }

  public void updateFinancials(
      BigDecimal billingAmount, BigDecimal expenses, BigDecimal commissions) {
    this.billingAmount = billingAmount;
    this.expenses = expenses != null ? expenses : BigDecimal.ZERO;
    this.commissions = commissions != null ? commissions : BigDecimal.ZERO;
    this.updatedAt = Instant.now();
  }

  public void changeStatus(JobStatus target) {
    this.jobStatus = target;
    if (target == JobStatus.COMPLETED && completedDate == null) {
      this.completedDate = LocalDate.now();
    }
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getPlatformId() {
    return platformId;
  }

  public String getPlatformJobCode() {
    return platformJobCode;
  }

  public void setPlatformJobCode(String platformJobCode) {
    this.platformJobCode = platformJobCode;
  }

  public String getTicketNumber() {
    return ticketNumber;
  }

  public String getDescription() {
    return description;
  }

  public String getClientName() {
    return clientName;
  }

  public void setClientName(String clientName) {
    this.clientName = clientName;
  }

  public BillingType getBillingType() {
    return billingType;
  }

  public BigDecimal getBillingAmount() {
    return billingAmount;
  }

  public BigDecimal getExpenses() {
    return expenses;
  }

  public BigDecimal getCommissions() {
    return commissions;
  }

  public JobStatus getJobStatus() {
    return jobStatus;
  }

  public LocalDate getJobDate() {
    return jobDate;
  }

  public LocalDate getCompletedDate() {
    return completedDate;
  }

  public String getExternalUrl() {
    return externalUrl;
  }

  public void setExternalUrl(String externalUrl) {
    this.externalUrl = externalUrl;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
