package io.intellixity.plantframe.analysis.io;

import io.intellixity.plantframe.exec.BackendEngine;
import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.frame.SchemaContract;

/** Source of named datasets. Loaded rows are placed under the given engine's control. */
public interface DatasetLoader {
  /**
   * @throws io.intellixity.plantframe.error.NotFoundException unknown dataset
   * @throws io.intellixity.plantframe.error.SchemaException data does not satisfy {@code contract}
   */
  ComputationHandle load(String name, BackendEngine engine, SchemaContract contract);

  default ComputationHandle load(String name, BackendEngine engine) {
    return load(name, engine, SchemaContract.none());
  }
}
