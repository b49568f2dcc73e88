package io.worktrack.backend.importing;

import java.util.List;

public record ImportSummary(
    int importedJobs,
    int skippedJobs,
    int importedEntries,
    int skippedEntries,
    List<String> errors) {

  public ImportSummary {
    errors = List.copyOf(errors);
  }
}
