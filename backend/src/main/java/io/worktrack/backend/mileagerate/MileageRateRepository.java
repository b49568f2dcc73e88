package io.worktrack.backend.mileagerate;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MileageRateRepository extends JpaRepository<MileageRate, UUID> {

  /** Rates effective on the given date, most recent first. */
  @Query(
      """
      SELECT mr FROM MileageRate mr
      WHERE mr.effectiveFrom <= :date
        AND (mr.effectiveTo IS NULL OR mr.effectiveTo >= :date)
      ORDER BY mr.effectiveFrom DESC
      """)
  List<MileageRate> findEffectiveOn(@Param("date") LocalDate date);

  boolean existsByEffectiveFrom(LocalDate effectiveFrom);

  Optional<MileageRate> findFirstByEffectiveFromAfterOrderByEffectiveFromAsc(LocalDate date);

  List<MileageRate> findAllByOrderByEffectiveFromDesc();
}
