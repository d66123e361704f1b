package io.intellixity.plantframe.toolkit;

import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.frame.SchemaContract;

import java.util.List;

/**
 * Reusable, engine-agnostic transformation over a {@link ComputationHandle}.\n
 *
 * A toolkit only calls engine operations through the handle, so the same toolkit runs on every engine.\n
 */
public interface Toolkit {
  ToolkitId id();

  default String description() {
    return "";
  }

  /** Columns the input handle must carry. */
  SchemaContract inputContract();

  /** Columns guaranteed to exist on the output handle. */
  List<String> outputColumns();

  ComputationHandle apply(ComputationHandle input, ToolkitParams params);

  default ComputationHandle apply(ComputationHandle input) {
    return apply(input, ToolkitParams.empty());
  }
}
