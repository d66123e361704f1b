package io.intellixity.plantframe.analysis.run;

import io.intellixity.plantframe.toolkit.ToolkitId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** One toolkit application during a run. Handles are lazy, so the duration covers planning only. */
public record ToolkitDiagnostic(ToolkitId toolkit,
                                Map<String, Object> params,
                                List<String> inputColumns,
                                List<String> outputColumns,
                                long durationMillis) {
  public ToolkitDiagnostic {
    params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    inputColumns = List.copyOf(inputColumns);
    outputColumns = List.copyOf(outputColumns);
  }
}
