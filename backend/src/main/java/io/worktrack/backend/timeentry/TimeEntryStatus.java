package io.worktrack.backend.timeentry;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Time entry lifecycle. Rejection is the {@code SUBMITTED -> DRAFT} edge. Billed and paid are
 * driven by the payroll close workflow.
 */
public enum TimeEntryStatus {
  DRAFT,
  SUBMITTED,
  VERIFIED,
  BILLED,
  PAID;

  /** Statuses that count toward pay calculation and reports. */
  public static final Set<TimeEntryStatus> PAYABLE = EnumSet.of(VERIFIED, BILLED, PAID);

  /** Statuses that still need action before a pay period can close. */
  public static final Set<TimeEntryStatus> PENDING = EnumSet.of(DRAFT, SUBMITTED);

  private static final Map<TimeEntryStatus, Set<TimeEntryStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          DRAFT, Set.of(SUBMITTED),
          SUBMITTED, Set.of(VERIFIED, DRAFT),
          VERIFIED, Set.of(BILLED),
          BILLED, Set.of(PAID),
          PAID, Set.of());

  /** Returns the set of statuses this status can transition to. */
  public Set<TimeEntryStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  /** Returns true if transitioning from this status to the target is allowed. */
  public boolean canTransitionTo(TimeEntryStatus target) {
    return allowedTransitions().contains(target);
  }

  public boolean isPayable() {
    return PAYABLE.contains(this);
  }
}
