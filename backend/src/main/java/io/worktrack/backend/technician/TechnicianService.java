package io.worktrack.backend.technician;

import io.worktrack.backend.audit.AuditEventBuilder;
import io.worktrack.backend.audit.AuditService;
import io.worktrack.backend.exception.InvalidStateException;
import io.worktrack.backend.exception.ResourceNotFoundException;
import io.worktrack.backend.security.AccessGuard;
import io.worktrack.backend.security.ActingUser;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TechnicianService {

  private static final Logger log = LoggerFactory.getLogger(TechnicianService.class);

  private final TechnicianRepository technicianRepository;
  private final AuditService auditService;

  public TechnicianService(TechnicianRepository technicianRepository, AuditService auditService) {
    this.technicianRepository = technicianRepository;
    this.auditService = auditService;
  }

  @Transactional
  public Technician createTechnician(
      String name, String email, String phone, BigDecimal hourlyRate, ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "create technicians");
    if (name == null || name.isBlank()) {
      throw new InvalidStateException("Invalid technician", "Technician name is required");
    }
    requireNonNegativeRate(hourlyRate);

    var technician =
        technicianRepository.save(new Technician(name.trim(), email, phone, hourlyRate));
    log.info("Created technician {} ({})", technician.getId(), technician.getName());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("technician.created")
            .entityType("technician")
            .entityId(technician.getId())
            .actor(actor)
            .details(
                Map.of(
                    "name", technician.getName(),
                    "hourly_rate", technician.getHourlyRate().toString()))
            .build());
    return technician;
  }

  @Transactional
  public Technician updateHourlyRate(UUID technicianId, BigDecimal hourlyRate, ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "change technician rates");
    requireNonNegativeRate(hourlyRate);
    var technician = requireTechnician(technicianId);

    String oldRate = technician.getHourlyRate().toString();
    technician.changeHourlyRate(hourlyRate);
    technician = technicianRepository.save(technician);
    log.info(
        "Updated minimum rate of technician {} from {} to {}", technicianId, oldRate, hourlyRate);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("technician.updated")
            .entityType("technician")
            .entityId(technicianId)
            .actor(actor)
            .details(Map.of("hourly_rate", Map.of("from", oldRate, "to", hourlyRate.toString())))
            .build());
    return technician;
  }

  @Transactional
  public Technician deactivate(UUID technicianId, ActingUser actor) {
    AccessGuard.requireManagerOrAdmin(actor, "deactivate technicians");
    var technician = requireTechnician(technicianId);
    if (!technician.isActive()) {
      return technician;
    }
    technician.deactivate();
    technician = technicianRepository.save(technician);
    log.info("Deactivated technician {}", technicianId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("technician.deactivated")
            .entityType("technician")
            .entityId(technicianId)
            .actor(actor)
            .details(Map.of("status", Map.of("from", "ACTIVE", "to", "INACTIVE")))
            .build());
    return technician;
  }

  @Transactional(readOnly = true)
  public List<Technician> listActiveTechnicians() {
    return technicianRepository.findByStatusOrderByNameAsc(TechnicianStatus.ACTIVE);
  }

  @Transactional(readOnly = true)
  public Technician requireTechnician(UUID technicianId) {
    return technicianRepository
        .findById(technicianId)
        .orElseThrow(() -> new ResourceNotFoundException("Technician", technicianId));
  }

  private static void requireNonNegativeRate(BigDecimal hourlyRate) {
    if (hourlyRate == null || hourlyRate.signum() < 0) {
      throw new InvalidStateException(
          "Invalid hourly rate", "Minimum hourly rate must be zero or positive");
    }
  }
}
