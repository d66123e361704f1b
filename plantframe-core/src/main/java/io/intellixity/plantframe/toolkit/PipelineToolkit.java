package io.intellixity.plantframe.toolkit;

import io.intellixity.plantframe.error.SchemaException;
import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.SchemaContract;

import java.util.*;

/**
 * Toolkit made of an ordered list of named steps.\n
 *
 * The input contract is checked before the first step and the declared output columns after the last one; both
 * raise {@link SchemaException}. A step may be an engine operation, a pure function applied through
 * {@code derive}, or another toolkit.\n
 */
public final class PipelineToolkit implements Toolkit {
  private final ToolkitId id;
  private final String description;
  private final SchemaContract inputContract;
  private final List<String> outputColumns;
  private final ToolkitParams defaults;
  private final List<NamedStep> steps;

  public record NamedStep(String name, ToolkitStep step) {
    public NamedStep {
      if (name == null || name.isBlank()) throw new IllegalArgumentException("step name is required");
      Objects.requireNonNull(step, "step");
    }
  }

  private PipelineToolkit(Builder b) {
    this.id = new ToolkitId(b.name, b.version);
    this.description = b.description;
    this.inputContract = b.inputContract;
    this.outputColumns = List.copyOf(b.outputColumns);
    this.defaults = b.defaults;
    this.steps = List.copyOf(b.steps);
    if (steps.isEmpty()) throw new IllegalArgumentException("Toolkit " + id + " has no steps");
  }

  public static Builder builder(String name, String version) {
    return new Builder(name, version);
  }

  @Override public ToolkitId id() { return id; }
  @Override public String description() { return description; }
  @Override public SchemaContract inputContract() { return inputContract; }
  @Override public List<String> outputColumns() { return outputColumns; }

  public ToolkitParams defaults() { return defaults; }

  public List<String> stepNames() {
    List<String> out = new ArrayList<>(steps.size());
    for (NamedStep s : steps) out.add(s.name());
    return out;
  }

  @Override
  public ComputationHandle apply(ComputationHandle input, ToolkitParams params) {
    Objects.requireNonNull(input, "input");
    inputContract.check(input.schema(), "Input of toolkit " + id);
    ToolkitParams effective = defaults.merge(params == null ? ToolkitParams.empty() : params);

    ComputationHandle current = input;
    for (NamedStep s : steps) {
      ComputationHandle next = s.step().apply(current, effective);
      if (next == null) throw new IllegalStateException("Step '" + s.name() + "' of toolkit " + id + " returned null");
      current = next;
    }

    FrameSchema out = current.schema();
    List<String> missing = new ArrayList<>();
    for (String c : outputColumns) if (!out.has(c)) missing.add(c);
    if (!missing.isEmpty()) {
      throw new SchemaException("Toolkit " + id + " did not produce declared columns " + missing + "; output is " + out);
    }
    return current;
  }

  @Override
  public String toString() {
    return "PipelineToolkit{" + id + ", steps=" + stepNames() + "}";
  }

  public static final class Builder {
    private final String name;
    private final String version;
    private String description = "";
    private SchemaContract inputContract = SchemaContract.none();
    private final List<String> outputColumns = new ArrayList<>();
    private ToolkitParams defaults = ToolkitParams.empty();
    private final List<NamedStep> steps = new ArrayList<>();

    private Builder(String name, String version) {
      this.name = name;
      this.version = version;
    }

    public Builder description(String d) {
      this.description = d == null ? "" : d;
      return this;
    }

    public Builder requires(SchemaContract contract) {
      this.inputContract = Objects.requireNonNull(contract, "contract");
      return this;
    }

    public Builder produces(String... columns) {
      outputColumns.addAll(Arrays.asList(columns));
      return this;
    }

    public Builder defaults(ToolkitParams d) {
      this.defaults = Objects.requireNonNull(d, "defaults");
      return this;
    }

    public Builder step(String stepName, ToolkitStep step) {
      steps.add(new NamedStep(stepName, step));
      return this;
    }

    /** Nested toolkit as a step; it receives the enclosing toolkit's effective parameters. */
    public Builder then(Toolkit nested) {
      Objects.requireNonNull(nested, "nested");
      steps.add(new NamedStep(nested.id().toString(), nested::apply));
      return this;
    }

    public PipelineToolkit build() {
      return new PipelineToolkit(this);
    }
  }
}
