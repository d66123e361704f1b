package io.intellixity.plantframe.spi.kernel;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

final class CanonicalOrderTest {

  @Test
  void missingValuesSortTheSameWayFromAnyStartingOrder() {
    List<List<Object>> rows = new ArrayList<>();
    rows.add(Arrays.asList("M1", null));
    rows.add(Arrays.asList("M1", Double.NaN));
    rows.add(Arrays.asList("M1", 2.0));
    rows.add(Arrays.asList("M1", null));
    rows.add(Arrays.asList("M1", -1.0));
    rows.add(Arrays.asList("M1", Double.NaN));
    rows.add(Arrays.asList(null, 0.0));
    List<List<Object>> expected = List.of(
        Arrays.asList(null, 0.0),
        Arrays.asList("M1", null),
        Arrays.asList("M1", null),
        Arrays.asList("M1", Double.NaN),
        Arrays.asList("M1", Double.NaN),
        Arrays.asList("M1", -1.0),
        Arrays.asList("M1", 2.0));
    Random random = new Random(7);
    for (int i = 0; i < 50; i++) {
      Collections.shuffle(rows, random);
      assertEquals(expected, CanonicalOrder.sort(rows));
    }
  }
}
