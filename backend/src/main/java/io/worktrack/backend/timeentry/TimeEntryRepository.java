package io.worktrack.backend.timeentry;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TimeEntryRepository extends JpaRepository<TimeEntry, UUID> {

  List<TimeEntry> findByJobIdAndStatusIn(UUID jobId, Collection<TimeEntryStatus> statuses);

  List<TimeEntry> findByJobIdInAndStatusIn(
      Collection<UUID> jobIds, Collection<TimeEntryStatus> statuses);

  List<TimeEntry> findByJobIdOrderByDateWorkedAscCreatedAtAsc(UUID jobId);

  List<TimeEntry> findByTechnicianIdIsNullOrderByDateWorkedAsc();

  @Query(
      """
      SELECT te FROM TimeEntry te
      WHERE te.technicianId = :technicianId
        AND te.dateWorked >= :fromDate
        AND te.dateWorked <= :toDate
      ORDER BY te.dateWorked, te.createdAt
      """)
  List<TimeEntry> findByTechnicianAndDateRange(
      @Param("technicianId") UUID technicianId,
      @Param("fromDate") LocalDate fromDate,
      @Param("toDate") LocalDate toDate);

  @Query(
      """
      SELECT te FROM TimeEntry te
      WHERE te.status IN :statuses
        AND te.dateWorked >= :fromDate
        AND te.dateWorked <= :toDate
      ORDER BY te.dateWorked, te.createdAt
      """)
  List<TimeEntry> findByStatusInAndDateRange(
      @Param("statuses") Collection<TimeEntryStatus> statuses,
      @Param("fromDate") LocalDate fromDate,
      @Param("toDate") LocalDate toDate);

  /** Import dedup key: an entry with the same job, date and hours already exists. */
  boolean existsByJobIdAndDateWorkedAndHoursWorked(
      UUID jobId, LocalDate dateWorked, BigDecimal hoursWorked);

  List<TimeEntry> findByPayPeriodId(UUID payPeriodId);

  long countByPayPeriodIdAndStatusIn(UUID payPeriodId, Collection<TimeEntryStatus> statuses);

  @Query(
      """
      SELECT te FROM TimeEntry te
      WHERE te.payPeriodId IS NULL
        AND te.dateWorked >= :fromDate
        AND te.dateWorked <= :toDate
      """)
  List<TimeEntry> findUnperiodedInRange(
      @Param("fromDate") LocalDate fromDate, @Param("toDate") LocalDate toDate);
}
