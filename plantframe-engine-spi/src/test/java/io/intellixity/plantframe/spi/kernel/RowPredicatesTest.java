package io.intellixity.plantframe.spi.kernel;

import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.query.FilterElement;
import io.intellixity.plantframe.query.Filters;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

final class RowPredicatesTest {
  private static final FrameSchema S = FrameSchema.builder().strings("asset_id").doubles("power_kw").build();

  private static boolean test(FilterElement f, Object id, Object power) {
    Predicate<List<Object>> p = RowPredicates.compile(f, S);
    return p.test(Arrays.asList(id, power));
  }

  @Test
  void missingValuesNeverSatisfyComparisons() {
    assertFalse(test(Filters.gt("power_kw", 1.0), "T1", Double.NaN));
    assertFalse(test(Filters.le("power_kw", 1.0), "T1", null));
    assertFalse(test(Filters.ne("power_kw", 1.0), "T1", Double.NaN));
    assertTrue(test(Filters.isNull("power_kw"), "T1", Double.NaN));
    assertTrue(test(Filters.eq("power_kw", null), "T1", null));
  }

  @Test
  void notInvertsIncludingMissingRows() {
    assertTrue(test(Filters.not(Filters.gt("power_kw", 1.0)), "T1", Double.NaN));
    assertFalse(test(Filters.notNull("power_kw"), "T1", null));
  }

  @Test
  void numericComparisonsMixIntegralAndFloating() {
    assertTrue(test(Filters.eq("power_kw", 2L), "T1", 2.0));
    assertTrue(test(Filters.range("power_kw", 1L, 2.5), "T1", 2.5));
    assertTrue(test(Filters.in("power_kw", List.of(1L, 2L)), "T1", 2.0));
    assertTrue(test(Filters.nin("power_kw", List.of(1L)), "T1", 2.0));
  }

  @Test
  void groupsAndLike() {
    FilterElement f = Filters.or(Filters.like("asset_id", "WTG_0%"), Filters.and(Filters.eq("asset_id", "MET"), Filters.gt("power_kw", 0.0)));
    assertTrue(test(f, "WTG_01", 0.0));
    assertTrue(test(f, "MET", 1.0));
    assertFalse(test(f, "MET", 0.0));
    assertFalse(test(f, "WTG.01", 5.0));
  }

  @Test
  void likePatternQuotesRegexCharacters() {
    assertTrue(RowPredicates.likePattern("a.b_").matcher("a.bc").matches());
    assertFalse(RowPredicates.likePattern("a.b_").matcher("axbc").matches());
    assertTrue(RowPredicates.likePattern("%[x]%").matcher("tag [x] end").matches());
  }

  @Test
  void rowConditionSeesNamedColumns() {
    FilterElement f = Filters.row(List.of("power_kw"), r -> r.getDouble("power_kw") > 100);
    assertTrue(test(f, "T1", 150.0));
    assertFalse(test(f, "T1", 50.0));
  }
}
