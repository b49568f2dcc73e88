package io.worktrack.backend.timeentry;

import java.util.List;
import java.util.UUID;

/** Per-entry outcome of a bulk submit or verify. One entry failing never blocks the others. */
public record BulkTransitionResult(List<UUID> succeeded, List<TransitionFailure> failed) {

  public BulkTransitionResult {
    succeeded = List.copyOf(succeeded);
    failed = List.copyOf(failed);
  }

  public int successCount() {
    return succeeded.size();
  }

  public int failureCount() {
    return failed.size();
  }
}
