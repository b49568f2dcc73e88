package io.worktrack.backend.importing;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * A work order delivered by a platform scraper.
 *
 * @param platformCode short platform code, e.g. {@code FN}; the platform is created if unknown
 * @param workOrderId the platform's own job code
 * @param totalPay the platform payout, stored as the job's billing amount; may be unknown
 */
public record WorkOrderCandidate(
    String platformCode,
    String platformName,
    String workOrderId,
    String externalUrl,
    String title,
    String clientName,
    BigDecimal totalPay,
    LocalDate scheduledDate,
    List<TimeEntryCandidate> timeEntries) {

  public WorkOrderCandidate {
    timeEntries = timeEntries != null ? List.copyOf(timeEntries) : List.of();
  }
}
