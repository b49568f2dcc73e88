package io.worktrack.backend.payperiod;

import io.worktrack.backend.exception.InvalidStateException;
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
import java.util.UUID;

/**
 * A payroll window. Time entries are grouped into periods by date; the pay engine never mutates a
 * period. Closing records the payable hours at that moment.
 */
@Entity
@Table(name = "pay_periods")
public class PayPeriod {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", length = 100)
  private String name;

  @Column(name = "start_date", nullable = false)
  private LocalDate startDate;

  @Column(name = "end_date", nullable = false)
  private LocalDate endDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private PayPeriodStatus status;

  @Column(name = "total_hours", precision = 10, scale = 2)
  private BigDecimal totalHours;

  @Column(name = "closed_at")
  private Instant closedAt;

  @Column(name = "closed_by")
  private UUID closedBy;

  @Version private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected PayPeriod() {}

  public PayPeriod(String name, LocalDate startDate, LocalDate endDate) {
    this.name = name;
    this.startDate = startDate;
    this.endDate = endDate;
    this.status = PayPeriodStatus.OPEN;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(startDate) && !date.isAfter(endDate);
  }

  public boolean isOpen() {
    return status == PayPeriodStatus.OPEN;
  }

  public void close(BigDecimal totalHours, UUID closedBy) {
    requireTransition(PayPeriodStatus.CLOSED);
    this.status = PayPeriodStatus.CLOSED;
    this.totalHours = totalHours;
    this.closedBy = closedBy;
    this.closedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void archive() {
    requireTransition(PayPeriodStatus.ARCHIVED);
    this.status = PayPeriodStatus.ARCHIVED;
    this.updatedAt = Instant.now();
  }

  private void requireTransition(PayPeriodStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid pay period status", "Cannot move pay period from " + status + " to " + target);
    }
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public PayPeriodStatus getStatus() {
    return status;
  }

  public BigDecimal getTotalHours() {
    return totalHours;
  }

  public Instant getClosedAt() {
    return closedAt;
  }

  public UUID getClosedBy() {
    return closedBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
