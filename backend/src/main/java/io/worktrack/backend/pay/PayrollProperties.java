package io.worktrack.backend.pay;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Payroll rules.
 *
 * @param techPoolShare fraction of job net that forms the technician pool (company keeps the rest)
 * @param minimumRateFloor whether a technician's hourly rate is guaranteed as a floor
 */
@ConfigurationProperties(prefix = "worktrack.payroll")
public record PayrollProperties(
    @DefaultValue("0.50") BigDecimal techPoolShare,
    @DefaultValue("true") boolean minimumRateFloor) {

  public static final BigDecimal DEFAULT_TECH_POOL_SHARE = new BigDecimal("0.50");

  public PayrollProperties {
    if (techPoolShare == null) {
      techPoolShare = DEFAULT_TECH_POOL_SHARE;
    }
    if (techPoolShare.signum() < 0 || techPoolShare.compareTo(BigDecimal.ONE) > 0) {
      throw new IllegalArgumentException(
          "worktrack.payroll.tech-pool-share must be between 0 and 1, was " + techPoolShare);
    }
  }

  public static PayrollProperties defaults() {
    return new PayrollProperties(DEFAULT_TECH_POOL_SHARE, true);
  }
}
