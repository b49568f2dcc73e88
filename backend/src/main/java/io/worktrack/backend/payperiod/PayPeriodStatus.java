package io.worktrack.backend.payperiod;

import java.util.Map;
import java.util.Set;

public enum PayPeriodStatus {
  OPEN,
  CLOSED,
  ARCHIVED;

  private static final Map<PayPeriodStatus, Set<PayPeriodStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          OPEN, Set.of(CLOSED),
          CLOSED, Set.of(ARCHIVED),
          ARCHIVED, Set.of());

  public boolean canTransitionTo(PayPeriodStatus target) {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
  }
}
