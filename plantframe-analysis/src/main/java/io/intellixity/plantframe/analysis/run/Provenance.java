package io.intellixity.plantframe.analysis.run;

import io.intellixity.plantframe.analysis.method.MethodId;
import io.intellixity.plantframe.exec.EngineDescriptor;
import io.intellixity.plantframe.frame.DatasetRef;

import java.time.Instant;
import java.util.*;

/**
 * Where a result came from: method, engine, resolved parameters and the datasets bound to each role.
 *
 * @param datasets lineage of every bound role, keyed by role name
 */
public record Provenance(String runId,
                        MethodId method,
                        EngineDescriptor engine,
                        Map<String, Object> parameters,
                        Map<String, List<DatasetRef>> datasets,
                        Instant startedAt,
                        Instant finishedAt) {
  public Provenance {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(engine, "engine");
    parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    Map<String, List<DatasetRef>> ds = new LinkedHashMap<>();
    datasets.forEach((k, v) -> ds.put(k, List.copyOf(v)));
    datasets = Collections.unmodifiableMap(ds);
  }
}
