package io.worktrack.backend.technician;

public enum TechnicianStatus {
  ACTIVE,
  INACTIVE
}
