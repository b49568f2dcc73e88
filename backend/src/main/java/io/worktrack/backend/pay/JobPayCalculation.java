package io.worktrack.backend.pay;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Pay for every technician on a job, derived on demand from the job, its payable entries, the
 * technicians' minimum rates and the mileage rate history. Never persisted.
 *
 * @param profitShare job net minus total base pay; allocated to rows by hours for reporting
 */
public record JobPayCalculation(
    UUID jobId,
    JobPayStatus status,
    BigDecimal jobNet,
    BigDecimal techPool,
    BigDecimal totalHours,
    BigDecimal totalBasePay,
    BigDecimal profitShare,
    List<TechnicianPay> technicians,
    List<PayWarning> warnings) {

  public JobPayCalculation {
    technicians = List.copyOf(technicians);
    warnings = List.copyOf(warnings);
  }

  static JobPayCalculation empty(
      UUID jobId, JobPayStatus status, BigDecimal jobNet, List<PayWarning> warnings) {
    var zero = PayMath.cents(BigDecimal.ZERO);
    return new JobPayCalculation(
        jobId,
        status,
        jobNet != null ? PayMath.cents(jobNet) : null,
        zero,
        zero,
        zero,
        zero,
        List.of(),
        warnings);
  }

  public Optional<TechnicianPay> forTechnician(UUID technicianId) {
    return technicians.stream().filter(t -> t.technicianId().equals(technicianId)).findFirst();
  }

  public BigDecimal totalPay() {
    return technicians.stream().map(TechnicianPay::totalPay).reduce(zero(), BigDecimal::add);
  }

  public BigDecimal totalMileagePay() {
    return technicians.stream().map(TechnicianPay::mileagePay).reduce(zero(), BigDecimal::add);
  }

  private static BigDecimal zero() {
    return PayMath.cents(BigDecimal.ZERO);
  }
}
