package io.intellixity.plantframe.exec;

import java.util.Objects;

/**
 * Identity and capabilities of an engine instance, recorded in run provenance.
 *
 * @param id unique instance id (used in logs and error messages)
 * @param variant provider variant id ({@code local}, {@code partitioned}, {@code cluster})
 */
public record EngineDescriptor(String id, String variant, ExecutionMode mode, ResourceLimits limits) {
  public EngineDescriptor {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
    if (variant == null || variant.isBlank()) throw new IllegalArgumentException("variant is required");
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(limits, "limits");
  }
}
