package io.worktrack.backend.mileagerate;

import static org.assertj.core.api.Assertions.assertThat;

import io.worktrack.backend.testutil.TestEntities;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class MileageRateTableTest {

  private final MileageRateTable table =
      new MileageRateTable(
          List.of(
              TestEntities.mileageRate("0.70", LocalDate.of(2026, 1, 1), null),
              TestEntities.mileageRate(
                  "0.655", LocalDate.of(2025, 1, 1), LocalDate.of(2025, 12, 31))));

  @Test
  void picksTheRateCoveringTheWorkDate() {
    assertThat(table.rateOn(LocalDate.of(2025, 12, 31)))
        .hasValueSatisfying(rate -> assertThat(rate).isEqualByComparingTo("0.655"));
    assertThat(table.rateOn(LocalDate.of(2026, 1, 1)))
        .hasValueSatisfying(rate -> assertThat(rate).isEqualByComparingTo("0.70"));
    assertThat(table.rateOn(LocalDate.of(2030, 7, 4)))
        .hasValueSatisfying(rate -> assertThat(rate).isEqualByComparingTo("0.70"));
  }

  @Test
  void nothingBeforeTheFirstRate() {
    assertThat(table.rateOn(LocalDate.of(2024, 12, 31))).isEmpty();
    assertThat(MileageRateTable.empty().rateOn(LocalDate.of(2026, 1, 1))).isEmpty();
  }
}
