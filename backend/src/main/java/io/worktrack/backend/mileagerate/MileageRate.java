package io.worktrack.backend.mileagerate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Per-mile reimbursement rate effective from {@code effectiveFrom} through {@code effectiveTo}
 * (inclusive; null means open-ended).
 */
@Entity
@Table(name = "mileage_rates")
public class MileageRate {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "rate_per_mile", nullable = false, precision = 6, scale = 4)
  private BigDecimal ratePerMile;

  @Column(name = "effective_from", nullable = false)
  private LocalDate effectiveFrom;

  @Column(name = "effective_to")
  private LocalDate effectiveTo;

  @Column(name = "description", length = 200)
  private String description;

  @Column(name = "created_by")
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected MileageRate() {}

  public MileageRate(
      BigDecimal ratePerMile,
      LocalDate effectiveFrom,
      LocalDate effectiveTo,
      String description,
      UUID createdBy) {
    this.ratePerMile = ratePerMile;
    this.effectiveFrom = effectiveFrom;
    this.effectiveTo = effectiveTo;
    this.description = description;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public boolean isEffectiveOn(LocalDate date) {
    return !date.isBefore(effectiveFrom) && (effectiveTo == null || !date.isAfter(effectiveTo));
  }

  /** Ends this rate on the given day. */
  public void endOn(LocalDate lastDay) {
    this.effectiveTo = lastDay;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public BigDecimal getRatePerMile() {
    return ratePerMile;
  }

  public LocalDate getEffectiveFrom() {
    return effectiveFrom;
  }

  public LocalDate getEffectiveTo() {
    return effectiveTo;
  }

  public String getDescription() {
    return description;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
