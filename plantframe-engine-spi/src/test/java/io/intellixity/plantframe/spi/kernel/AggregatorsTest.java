package io.intellixity.plantframe.spi.kernel;

import io.intellixity.plantframe.query.aggregation.Aggregation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AggregatorsTest {
  private static List<List<Object>> rows(Object... values) {
    List<List<Object>> out = new ArrayList<>();
    for (Object v : values) out.add(Collections.singletonList(v));
    return out;
  }

  @Test
  void reducesIgnoringMissingValues() {
    List<List<Object>> rs = rows(1.0, Double.NaN, 3.0, null);
    assertEquals(4.0, Aggregators.reduce(Aggregation.sum("x"), rs, 0));
    assertEquals(2.0, Aggregators.reduce(Aggregation.mean("x"), rs, 0));
    assertEquals(2L, Aggregators.reduce(Aggregation.count("x"), rs, 0));
    assertEquals(4L, Aggregators.reduce(Aggregation.size(), rs, -1));
    assertEquals(0.5, Aggregators.reduce(Aggregation.nullFraction("x"), rs, 0));
    assertEquals(1.0, Aggregators.reduce(Aggregation.min("x"), rs, 0));
    assertEquals(3.0, Aggregators.reduce(Aggregation.max("x"), rs, 0));
    assertEquals(Math.sqrt(2.0), (double) Aggregators.reduce(Aggregation.std("x"), rs, 0), 1e-12);
  }

  @Test
  void emptyBucketResults() {
    List<List<Object>> none = List.of();
    assertEquals(0L, Aggregators.reduce(Aggregation.size(), none, -1));
    assertEquals(0L, Aggregators.reduce(Aggregation.count("x"), none, 0));
    assertEquals(0.0, Aggregators.reduce(Aggregation.sum("x"), none, 0));
    assertNull(Aggregators.reduce(Aggregation.mean("x"), none, 0));
    assertNull(Aggregators.reduce(Aggregation.max("x"), none, 0));
    assertNull(Aggregators.reduce(Aggregation.nullFraction("x"), none, 0));
    assertNull(Aggregators.reduce(Aggregation.std("x"), rows(1.0), 0));
  }

  @Test
  void resultDoesNotDependOnRowOrder() {
    List<List<Object>> a = rows(0.1, 0.2, 0.3, 1e16, -1e16);
    List<List<Object>> b = rows(-1e16, 0.3, 1e16, 0.2, 0.1);
    assertEquals(Aggregators.reduce(Aggregation.sum("x"), a, 0), Aggregators.reduce(Aggregation.sum("x"), b, 0));
    assertEquals(Aggregators.reduce(Aggregation.std("x"), a, 0), Aggregators.reduce(Aggregation.std("x"), b, 0));
  }
}
