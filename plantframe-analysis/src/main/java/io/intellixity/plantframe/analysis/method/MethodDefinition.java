package io.intellixity.plantframe.analysis.method;

import io.intellixity.plantframe.analysis.config.ConfigSchema;
import io.intellixity.plantframe.frame.SchemaContract;
import io.intellixity.plantframe.toolkit.ToolkitId;

import java.util.*;

/**
 * Immutable definition of an analysis method: identity, input roles, required toolkits, configuration schema,
 * result contract and run function.\n
 */
public final class MethodDefinition {
  private final MethodId id;
  private final String description;
  private final Map<String, RoleSpec> roles;
  private final List<ToolkitId> toolkits;
  private final ConfigSchema configSchema;
  private final SchemaContract resultContract;
  private final MethodRunFunction runFunction;

  private MethodDefinition(Builder b) {
    this.id = new MethodId(b.name, b.version);
    this.description = b.description;
    this.roles = Collections.unmodifiableMap(new LinkedHashMap<>(b.roles));
    this.toolkits = List.copyOf(b.toolkits);
    this.configSchema = b.configSchema;
    this.resultContract = b.resultContract;
    this.runFunction = Objects.requireNonNull(b.runFunction, "Method " + id + " has no run function");
  }

  public static Builder builder(String name, String version) {
    return new Builder(name, version);
  }

  public MethodId id() { return id; }
  public String name() { return id.name(); }
  public String version() { return id.version(); }
  public String description() { return description; }
  public Map<String, RoleSpec> roles() { return roles; }
  public List<ToolkitId> toolkits() { return toolkits; }
  public ConfigSchema configSchema() { return configSchema; }
  public SchemaContract resultContract() { return resultContract; }
  public MethodRunFunction runFunction() { return runFunction; }

  /** Declared toolkit with this name, or null. */
  public ToolkitId toolkit(String name) {
    for (ToolkitId t : toolkits) if (t.name().equals(name)) return t;
    return null;
  }

  @Override
  public String toString() {
    return "MethodDefinition{" + id + ", roles=" + roles.keySet() + ", toolkits=" + toolkits + "}";
  }

  public static final class Builder {
    private final String name;
    private final String version;
    private String description = "";
    private final Map<String, RoleSpec> roles = new LinkedHashMap<>();
    private final List<ToolkitId> toolkits = new ArrayList<>();
    private ConfigSchema configSchema = ConfigSchema.empty();
    private SchemaContract resultContract = SchemaContract.none();
    private MethodRunFunction runFunction;

    private Builder(String name, String version) {
      this.name = name;
      this.version = version;
    }

    public Builder description(String d) {
      this.description = d == null ? "" : d;
      return this;
    }

    public Builder role(RoleSpec role) {
      if (roles.putIfAbsent(role.name(), role) != null) {
        throw new IllegalArgumentException("Duplicate role '" + role.name() + "'");
      }
      return this;
    }

    public Builder role(String roleName, SchemaContract contract) {
      return role(RoleSpec.required(roleName, contract));
    }

    public Builder optionalRole(String roleName, SchemaContract contract) {
      return role(RoleSpec.optional(roleName, contract));
    }

    public Builder toolkit(String toolkitName, String toolkitVersion) {
      toolkits.add(new ToolkitId(toolkitName, toolkitVersion));
      return this;
    }

    public Builder config(ConfigSchema schema) {
      this.configSchema = Objects.requireNonNull(schema, "schema");
      return this;
    }

    public Builder result(SchemaContract contract) {
      this.resultContract = Objects.requireNonNull(contract, "contract");
      return this;
    }

    public Builder run(MethodRunFunction fn) {
      this.runFunction = fn;
      return this;
    }

    public MethodDefinition build() {
      return new MethodDefinition(this);
    }
  }
}
