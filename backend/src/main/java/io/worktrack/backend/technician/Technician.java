package io.worktrack.backend.technician;

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
 * A field technician. {@code hourlyRate} is the guaranteed minimum hourly pay, not a fixed wage:
 * pay is allocated from the job's technician pool and only falls back to this rate when the
 * allocation would pay less.
 */
@Entity
@Table(name = "technicians")
public class Technician {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Column(name = "email", length = 100)
  private String email;

  @Column(name = "phone", length = 20)
  private String phone;

  @Column(name = "hourly_rate", nullable = false, precision = 10, scale = 2)
  private BigDecimal hourlyRate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TechnicianStatus status;

  @Column(name = "hire_date")
  private LocalDate hireDate;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Technician() {}

  public Technician(String name, String email, String phone, BigDecimal hourlyRate) {
    this.name = name;
    this.email = email;
    this.phone = phone;
    this.hourlyRate = hourlyRate != null ? hourlyRate : BigDecimal.ZERO;
    this.status = TechnicianStatus.ACTIVE;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getEmail() {
    return email;
  }

  public String getPhone() {
    return phone;
  }

  public BigDecimal getHourlyRate() {
    return hourlyRate;
  }

  public TechnicianStatus getStatus() {
    return status;
  }

  public boolean isActive() {
    return status == TechnicianStatus.ACTIVE;
  }

  public LocalDate getHireDate() {
    return hireDate;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setHireDate(LocalDate hireDate) {
    this.hireDate = hireDate;
    this.updatedAt = Instant.now();
  }

  public void changeHourlyRate(BigDecimal hourlyRate) {
    this.hourlyRate = hourlyRate;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.status = TechnicianStatus.INACTIVE;
    this.updatedAt = Instant.now();
  }
}
