package io.intellixity.plantframe.query.aggregation;

import java.util.*;

/** Grouping keys of a group aggregation; an empty key list means one global group. */
public record GroupBy(List<String> keys) {
  public GroupBy {
    keys = List.copyOf(keys == null ? List.of() : keys);
    if (new HashSet<>(keys).size() != keys.size()) throw new IllegalArgumentException("Duplicate group key in " + keys);
  }

  public static GroupBy of(String... keys) { return new GroupBy(List.of(keys)); }

  public static GroupBy global() { return new GroupBy(List.of()); }

  public boolean isGlobal() {
    return keys.isEmpty();
  }
}
