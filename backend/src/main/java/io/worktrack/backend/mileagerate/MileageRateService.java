package io.worktrack.backend.mileagerate;

import io.worktrack.backend.audit.AuditEventBuilder;
import io.worktrack.backend.audit.AuditService;
import io.worktrack.backend.exception.InvalidStateException;
import io.worktrack.backend.exception.ResourceConflictException;
import io.worktrack.backend.security.AccessGuard;
import io.worktrack.backend.security.ActingUser;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class MileageRateService {

  private static final Logger log = LoggerFactory.getLogger(MileageRateService.class);

  private final MileageRateRepository mileageRateRepository;
  private final AuditService auditService;

  public MileageRateService(
      MileageRateRepository mileageRateRepository, AuditService auditService) {
    this.mileageRateRepository = mileageRateRepository;
    this.auditService = auditService;
  }

  /**
   * Resolves the rate effective on the given work date.
   *
   * @return the rate, or empty if no rate history covers the date
   */
  @Transactional(readOnly = true)
  public Optional<MileageRate> resolveRate(LocalDate date) {
    var rates = mileageRateRepository.findEffectiveOn(date);
    return rates.isEmpty() ? Optional.empty() : Optional.of(rates.get(0));
  }

  /** Snapshot of the whole rate history for pricing a batch of entries. */
  @Transactional(readOnly = true)
  public MileageRateTable rateTable() {
    return new MileageRateTable(mileageRateRepository.findAll());
  }

  @Transactional(readOnly = true)
  public List<MileageRate> listMileageRates() {
    return mileageRateRepository.findAllByOrderByEffectiveFromDesc();
  }

  /**
   * Adds a rate starting on {@code effectiveFrom}. The rate in effect the day before is ended the
   * day before; if a later rate already exists the new one ends the day before that rate starts.
   * Existing rates keep pricing their own dates.
   */
  @Transactional
  public MileageRate createMileageRate(
      BigDecimal ratePerMile, LocalDate effectiveFrom, String description, ActingUser actor) {
    AccessGuard.requireAdmin(actor, "change mileage rates");
    if (ratePerMile == null || ratePerMile.signum() <= 0) {
      throw InvalidStateException.forField("rate per mile", "Rate per mile must be positive");
    }
    if (effectiveFrom == null) {
      throw InvalidStateException.forField("effective date", "Effective date is required");
    }
    if (mileageRateRepository.existsByEffectiveFrom(effectiveFrom)) {
      throw new ResourceConflictException(
          "mileage rate", effectiveFrom, "A mileage rate already starts on " + effectiveFrom);
    }

    var dayBefore = effectiveFrom.minusDays(1);
    for (var previous : mileageRateRepository.findEffectiveOn(effectiveFrom)) {
      log.info("Ending mileage rate {} on {}", previous.getId(), dayBefore);
      previous.endOn(dayBefore);
      mileageRateRepository.save(previous);
    }
    LocalDate effectiveTo =
        mileageRateRepository
            .findFirstByEffectiveFromAfterOrderByEffectiveFromAsc(effectiveFrom)
            .map(next -> next.getEffectiveFrom().minusDays(1))
            .orElse(null);

    var rate =
        mileageRateRepository.save(
            new MileageRate(ratePerMile, effectiveFrom, effectiveTo, description, actor.userId()));
    log.info("Created mileage rate {} of {} from {}", rate.getId(), ratePerMile, effectiveFrom);

    var details = new LinkedHashMap<String, Object>();
    details.put("rate_per_mile", ratePerMile.toString());
    details.put("effective_from", effectiveFrom.toString());
    details.put("effective_to", effectiveTo != null ? effectiveTo.toString() : "");
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("mileage_rate.created")
            .entityType("mileage_rate")
            .entityId(rate.getId())
            .actor(actor)
            .details(details)
            .build());
    return rate;
  }
}
