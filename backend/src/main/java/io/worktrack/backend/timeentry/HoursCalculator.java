package io.worktrack.backend.timeentry;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

/**
 * Converts clock times to decimal hours. Both times are truncated to the minute, a time out
 * earlier than the time in wraps past midnight, and the result is rounded half-up to two decimals.
 */
public final class HoursCalculator {

  private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);
  private static final long MINUTES_PER_DAY = 24 * 60;

  private HoursCalculator() {}

  public static BigDecimal hoursBetween(LocalTime timeIn, LocalTime timeOut) {
    var start = timeIn.truncatedTo(ChronoUnit.MINUTES);
    var end = timeOut.truncatedTo(ChronoUnit.MINUTES);
    long minutes = Duration.between(start, end).toMinutes();
    if (minutes < 0) {
      minutes += MINUTES_PER_DAY;
    }
    return BigDecimal.valueOf(minutes).divide(MINUTES_PER_HOUR, 2, RoundingMode.HALF_UP);
  }

  /**
   * Explicit hours win over clock times. Returns null when neither explicit hours nor both clock
   * times are present.
   */
  public static BigDecimal resolveHours(
      BigDecimal explicitHours, LocalTime timeIn, LocalTime timeOut) {
    if (explicitHours != null) {
      return explicitHours.setScale(2, RoundingMode.HALF_UP);
    }
    if (timeIn != null && timeOut != null) {
      return hoursBetween(timeIn, timeOut);
    }
    return null;
  }
}
