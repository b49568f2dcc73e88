package io.worktrack.backend.importing;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

/** A time log scraped from a platform work order. Hours win over clock times when both exist. */
public record TimeEntryCandidate(
    LocalDate dateWorked,
    LocalTime timeIn,
    LocalTime timeOut,
    BigDecimal hours,
    BigDecimal mileage) {}
