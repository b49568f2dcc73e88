package io.worktrack.backend.payperiod;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PayPeriodRepository extends JpaRepository<PayPeriod, UUID> {

  @Query(
      """
      SELECT pp FROM PayPeriod pp
      WHERE pp.startDate <= :endDate
        AND pp.endDate >= :startDate
      ORDER BY pp.startDate
      """)
  List<PayPeriod> findOverlapping(
      @Param("startDate") LocalDate startDate, @Param("endDate") LocalDate endDate);

  @Query(
      """
      SELECT pp FROM PayPeriod pp
      WHERE pp.status = io.worktrack.backend.payperiod.PayPeriodStatus.OPEN
        AND pp.startDate <= :date
        AND pp.endDate >= :date
      """)
  Optional<PayPeriod> findOpenContaining(@Param("date") LocalDate date);

  List<PayPeriod> findAllByOrderByStartDateDesc();
}
