package io.worktrack.backend.pay;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Money arithmetic: full precision while computing, cents on output. */
final class PayMath {

  static final int INTERNAL_SCALE = 10;

  private PayMath() {}

  static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
    return dividend.divide(divisor, INTERNAL_SCALE, RoundingMode.HALF_UP);
  }

  static BigDecimal cents(BigDecimal amount) {
    return amount.setScale(2, RoundingMode.HALF_UP);
  }

  static BigDecimal orZero(BigDecimal amount) {
    return amount != null ? amount : BigDecimal.ZERO;
  }
}
