package io.intellixity.plantframe.analysis.io;

import io.intellixity.plantframe.error.DuplicateNameException;
import io.intellixity.plantframe.error.NotFoundException;
import io.intellixity.plantframe.exec.BackendEngine;
import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.frame.DatasetRef;
import io.intellixity.plantframe.frame.MaterializedFrame;
import io.intellixity.plantframe.frame.SchemaContract;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/** Dataset loader over frames registered in memory; for tests and embedding. */
public final class InMemoryDatasetLoader implements DatasetLoader {
  private record Entry(DatasetRef ref, MaterializedFrame frame) {}

  private final Map<String, Entry> datasets = new ConcurrentHashMap<>();

  public InMemoryDatasetLoader register(String name, String version, MaterializedFrame frame) {
    Objects.requireNonNull(frame, "frame");
    DatasetRef ref = new DatasetRef(name, version);
    if (datasets.putIfAbsent(name, new Entry(ref, frame)) != null) {
      throw new DuplicateNameException("Dataset already registered: " + name);
    }
    return this;
  }

  public InMemoryDatasetLoader register(String name, MaterializedFrame frame) {
    return register(name, null, frame);
  }

  public Set<String> names() {
    return new TreeSet<>(datasets.keySet());
  }

  @Override
  public ComputationHandle load(String name, BackendEngine engine, SchemaContract contract) {
    Objects.requireNonNull(engine, "engine");
    Entry e = datasets.get(name);
    if (e == null) throw new NotFoundException("Unknown dataset: " + name + "; registered: " + names());
    (contract == null ? SchemaContract.none() : contract).check(e.frame().schema(), "Dataset " + e.ref());
    return engine.source(e.frame(), e.ref());
  }
}
