package io.worktrack.backend.pay;

import java.time.LocalDate;
import java.util.UUID;

/** A condition that did not stop the calculation but changed its result for one entry. */
public record PayWarning(
    PayWarningType type, UUID entryId, UUID technicianId, LocalDate dateWorked, String message) {}
