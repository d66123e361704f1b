package io.intellixity.plantframe.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Objects;

/**
 * JSON-addressable wrapper around a filter tree, e.g. toolkit parameters carrying
 * {@code {"and":[{"gt":{"field":"power_kw","value":0}}]}}.
 */
@JsonSerialize(using = FilterJsonSerializer.class)
@JsonDeserialize(using = FilterJsonDeserializer.class)
public final class Filter {
  private final FilterElement root;

  public Filter(FilterElement root) {
    this.root = Objects.requireNonNull(root, "root");
  }

  public static Filter of(FilterElement root) {
    return new Filter(root);
  }

  public FilterElement root() { return root; }

  @Override
  public boolean equals(Object o) {
    return o instanceof Filter f && root.equals(f.root);
  }

  @Override
  public int hashCode() {
    return root.hashCode();
  }

  @Override
  public String toString() {
    return "Filter(" + root + ")";
  }
}
