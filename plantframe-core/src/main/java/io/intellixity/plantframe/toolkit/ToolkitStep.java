package io.intellixity.plantframe.toolkit;

import io.intellixity.plantframe.exec.ComputationHandle;

/** One transformation inside a {@link PipelineToolkit}. */
@FunctionalInterface
public interface ToolkitStep {
  ComputationHandle apply(ComputationHandle input, ToolkitParams params);
}
