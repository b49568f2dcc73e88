package io.worktrack.backend.timeentry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.worktrack.backend.exception.InvalidTransitionException;
import io.worktrack.backend.testutil.TestEntities;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TimeEntryTest {

  private static final UUID MANAGER_ID = UUID.randomUUID();
  private static final LocalDate DAY = LocalDate.of(2026, 1, 5);

  @Test
  void submitRejectResubmitCycle() {
    var job = TestEntities.job("1000", "0", "0");
    var technician = TestEntities.technician("Ana", "20");
    var entry = TestEntities.draft(job, technician, DAY, "4");

    entry.submit(TestEntities.ACTOR_ID);
    assertThat(entry.getStatus()).isEqualTo(TimeEntryStatus.SUBMITTED);

    entry.reject("Wrong job", MANAGER_ID);
    assertThat(entry.getStatus()).isEqualTo(TimeEntryStatus.DRAFT);
    assertThat(entry.getRejectionReason()).isEqualTo("Wrong job");

    entry.submit(TestEntities.ACTOR_ID);
    assertThat(entry.getStatus()).isEqualTo(TimeEntryStatus.SUBMITTED);
    assertThat(entry.getRejectionReason()).isNull();
  }

  @Test
  void verifyRecordsVerifierAndTimestamp() {
    var entry =
        TestEntities.entry(
            TestEntities.job("100", "0", "0"),
            TestEntities.technician("Ana", "20"),
            DAY,
            "2",
            TimeEntryStatus.SUBMITTED);

    entry.verify(MANAGER_ID);

    assertThat(entry.getStatus()).isEqualTo(TimeEntryStatus.VERIFIED);
    assertThat(entry.getVerifiedBy()).isEqualTo(MANAGER_ID);
    assertThat(entry.getVerifiedAt()).isNotNull();
  }

  @Test
  void verifyFromDraftIsInvalid() {
    var entry =
        TestEntities.draft(
            TestEntities.job("100", "0", "0"), TestEntities.technician("Ana", "20"), DAY, "2");

    assertThatThrownBy(() -> entry.verify(MANAGER_ID))
        .isInstanceOf(InvalidTransitionException.class)
        .hasMessageContaining("DRAFT");
    assertThat(entry.getStatus()).isEqualTo(TimeEntryStatus.DRAFT);
  }

  @Test
  void rejectOnlyFromSubmitted() {
    var entry =
        TestEntities.verified(
            TestEntities.job("100", "0", "0"), TestEntities.technician("Ana", "20"), DAY, "2");

    assertThatThrownBy(() -> entry.reject("late", MANAGER_ID))
        .isInstanceOf(InvalidTransitionException.class);
    assertThat(entry.getStatus()).isEqualTo(TimeEntryStatus.VERIFIED);
  }

  @Test
  void paidEntriesCannotMoveAnyFurther() {
    var entry =
        TestEntities.entry(
            TestEntities.job("100", "0", "0"),
            TestEntities.technician("Ana", "20"),
            DAY,
            "2",
            TimeEntryStatus.PAID);

    assertThatThrownBy(() -> entry.markBilled(MANAGER_ID))
        .isInstanceOf(InvalidTransitionException.class);
    assertThatThrownBy(() -> entry.submit(MANAGER_ID))
        .isInstanceOf(InvalidTransitionException.class);
  }
}
