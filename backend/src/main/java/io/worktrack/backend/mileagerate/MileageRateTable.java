package io.worktrack.backend.mileagerate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of the rate history, queried by work date. Pay calculation takes one snapshot
 * per job so that every entry of the job is priced against the same history.
 */
public final class MileageRateTable {

  private final List<MileageRate> rates;

  public MileageRateTable(List<MileageRate> rates) {
    this.rates =
        rates.stream()
            .sorted(Comparator.comparing(MileageRate::getEffectiveFrom).reversed())
            .toList();
  }

  public static MileageRateTable empty() {
    return new MileageRateTable(List.of());
  }

  /** The rate per mile in effect on {@code date}, or empty when no rate covers it. */
  public Optional<BigDecimal> rateOn(LocalDate date) {
    return rates.stream()
        .filter(rate -> rate.isEffectiveOn(date))
        .findFirst()
        .map(MileageRate::getRatePerMile);
  }
}
