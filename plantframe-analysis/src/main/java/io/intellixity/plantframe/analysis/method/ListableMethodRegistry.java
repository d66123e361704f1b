package io.intellixity.plantframe.analysis.method;

import java.util.Collection;

public interface ListableMethodRegistry extends MethodRegistry {
  Collection<MethodDefinition> all();
  boolean contains(MethodId id);
}
