package io.worktrack.backend.timeentry;

import java.util.UUID;

public record TransitionFailure(UUID entryId, TransitionFailureReason reason, String detail) {}
