package io.intellixity.plantframe.analysis.run;

import io.intellixity.plantframe.frame.MaterializedFrame;

import java.util.List;
import java.util.Objects;

/** Outcome of a successful run. */
public record Result(MaterializedFrame payload,
                     List<ToolkitDiagnostic> diagnostics,
                     List<String> warnings,
                     Provenance provenance,
                     ResourceUsage usage) {
  public Result {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(provenance, "provenance");
    Objects.requireNonNull(usage, "usage");
    diagnostics = List.copyOf(diagnostics);
    warnings = List.copyOf(warnings);
  }
}
