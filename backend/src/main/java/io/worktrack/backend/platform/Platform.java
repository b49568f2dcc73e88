package io.worktrack.backend.platform;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A job-sourcing platform (WorkMarket, Field Nation, ...) that jobs are booked through. */
@Entity
@Table(name = "platforms")
public class Platform {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Column(name = "code", nullable = false, length = 20)
  private String code;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Platform() {}

  public Platform(String name, String code) {
    this.name = name;
    this.code = code;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getCode() {
    return code;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
