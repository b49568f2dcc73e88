package io.worktrack.backend.technician;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.worktrack.backend.audit.AuditService;
import io.worktrack.backend.exception.InvalidStateException;
import io.worktrack.backend.exception.ResourceNotFoundException;
import io.worktrack.backend.security.ActingUser;
import io.worktrack.backend.testutil.TestEntities;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TechnicianServiceTest {

  @Mock private TechnicianRepository technicianRepository;
  @Mock private AuditService auditService;
  @InjectMocks private TechnicianService technicianService;

  private final ActingUser manager = ActingUser.manager(UUID.randomUUID());

  @Test
  void createTrimsNameAndStartsActive() {
    when(technicianRepository.save(any(Technician.class)))
        .thenAnswer(inv -> TestEntities.withId(inv.<Technician>getArgument(0), UUID.randomUUID()));

    var technician =
        technicianService.createTechnician(
            "  Ana Reyes ", "ana@example.com", null, new BigDecimal("22.50"), manager);

    assertThat(technician.getName()).isEqualTo("Ana Reyes");
    assertThat(technician.isActive()).isTrue();
  }

  @Test
  void negativeRateIsRejected() {
    assertThatThrownBy(
            () ->
                technicianService.createTechnician(
                    "Ana", null, null, new BigDecimal("-1"), manager))
        .isInstanceOf(InvalidStateException.class);
    verify(technicianRepository, never()).save(any());
  }

  @Test
  void updateHourlyRateChangesFloor() {
    var ana = TestEntities.technician("Ana", "20");
    when(technicianRepository.findById(ana.getId())).thenReturn(Optional.of(ana));
    when(technicianRepository.save(ana)).thenReturn(ana);

    technicianService.updateHourlyRate(ana.getId(), new BigDecimal("25"), manager);

    assertThat(ana.getHourlyRate()).isEqualByComparingTo("25");
  }

  @Test
  void deactivateIsIdempotent() {
    var ana = TestEntities.technician("Ana", "20");
    ana.deactivate();
    when(technicianRepository.findById(ana.getId())).thenReturn(Optional.of(ana));

    var result = technicianService.deactivate(ana.getId(), manager);

    assertThat(result.isActive()).isFalse();
    verify(technicianRepository, never()).save(any());
    verify(auditService, never()).log(any());
  }

  @Test
  void unknownTechnicianIsNotFound() {
    var id = UUID.randomUUID();
    when(technicianRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> technicianService.requireTechnician(id))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
