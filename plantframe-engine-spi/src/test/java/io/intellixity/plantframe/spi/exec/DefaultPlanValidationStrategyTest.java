package io.intellixity.plantframe.spi.exec;

import io.intellixity.plantframe.error.SchemaException;
import io.intellixity.plantframe.frame.ColumnType;
import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.plan.JoinType;
import io.intellixity.plantframe.query.Condition;
import io.intellixity.plantframe.query.FilterElement;
import io.intellixity.plantframe.query.Filters;
import io.intellixity.plantframe.query.LogicalGroup;
import io.intellixity.plantframe.query.Clause;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import io.intellixity.plantframe.query.aggregation.GroupBy;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultPlanValidationStrategyTest {
  private static final FrameSchema METER = FrameSchema.builder()
      .timestamp("time")
      .doubles("energy_kwh")
      .strings("asset_id")
      .booleans("ok")
      .build();

  private final DefaultPlanValidationStrategy v = new DefaultPlanValidationStrategy();

  @Test
  void selectRejectsUnknownAndDuplicateColumns() {
    assertEquals(List.of("asset_id", "time"), v.validateSelect(METER, List.of("asset_id", "time")).names());
    assertThrows(SchemaException.class, () -> v.validateSelect(METER, List.of("nope")));
    assertThrows(SchemaException.class, () -> v.validateSelect(METER, List.of("time", "time")));
    assertThrows(SchemaException.class, () -> v.validateSelect(METER, List.of()));
  }

  @Test
  void filterCoercesOperandsToColumnType() {
    FilterElement f = v.validateFilter(METER, Filters.ge("time", "2020-01-01T00:00:00Z"));
    Condition c = (Condition) f;
    assertEquals(Instant.parse("2020-01-01T00:00:00Z"), c.value());
  }

  @Test
  void filterRejectsTypeMismatches() {
    assertThrows(SchemaException.class, () -> v.validateFilter(METER, Filters.gt("energy_kwh", "ten")));
    assertThrows(SchemaException.class, () -> v.validateFilter(METER, Filters.gt("ok", true)));
    assertThrows(SchemaException.class, () -> v.validateFilter(METER, Filters.like("energy_kwh", "1%")));
    assertThrows(SchemaException.class, () -> v.validateFilter(METER, Filters.gt("missing", 1)));
    assertThrows(SchemaException.class, () -> v.validateFilter(METER, Filters.range("energy_kwh", 1.0, null)));
    assertThrows(SchemaException.class, () -> v.validateFilter(METER, new LogicalGroup(Clause.AND, List.of())));
  }

  @Test
  void filterAcceptsNullEqualityAndNestedGroups() {
    assertDoesNotThrow(() -> v.validateFilter(METER, Filters.eq("asset_id", null)));
    assertDoesNotThrow(() -> v.validateFilter(METER,
        Filters.or(Filters.in("asset_id", List.of("T1", "T2")), Filters.not(Filters.isNull("energy_kwh")))));
  }

  @Test
  void renameRequiresExistingSources() {
    FrameSchema s = v.validateRename(METER, Map.of("energy_kwh", "e"));
    assertEquals(ColumnType.DOUBLE, s.typeOf("e"));
    assertThrows(SchemaException.class, () -> v.validateRename(METER, Map.of("nope", "x")));
    assertThrows(SchemaException.class, () -> v.validateRename(METER, Map.of("time", " ")));
  }

  @Test
  void resampleNeedsTimestampAndNumericInputs() {
    FrameSchema s = v.validateResample(METER, "time",
        List.of(Aggregation.sum("energy_kwh"), Aggregation.count("energy_kwh"), Aggregation.size()));
    assertEquals(List.of("time", "energy_kwh", "energy_kwh_count", "size"), s.names());
    assertEquals(ColumnType.LONG, s.typeOf("size"));
    assertThrows(SchemaException.class, () -> v.validateResample(METER, "asset_id", List.of(Aggregation.size())));
    assertThrows(SchemaException.class, () -> v.validateResample(METER, "time", List.of(Aggregation.mean("asset_id"))));
    assertThrows(SchemaException.class,
        () -> v.validateResample(METER, "time", List.of(Aggregation.size(), Aggregation.size())));
  }

  @Test
  void joinChecksKeyTypesAndCollisions() {
    FrameSchema weather = FrameSchema.builder().timestamp("time").doubles("temp_c").build();
    FrameSchema joined = v.validateJoin(METER, weather, List.of("time"), JoinType.LEFT);
    assertEquals(List.of("time", "energy_kwh", "asset_id", "ok", "temp_c"), joined.names());

    FrameSchema clash = FrameSchema.builder().timestamp("time").doubles("energy_kwh").build();
    assertThrows(SchemaException.class, () -> v.validateJoin(METER, clash, List.of("time"), JoinType.INNER));

    FrameSchema wrongType = FrameSchema.builder().strings("time").build();
    assertThrows(SchemaException.class, () -> v.validateJoin(METER, wrongType, List.of("time"), JoinType.INNER));
  }

  @Test
  void groupAggregateOutputsKeysThenAggregations() {
    FrameSchema s = v.validateGroupAggregate(METER, GroupBy.of("asset_id"),
        List.of(Aggregation.max("time"), Aggregation.std("energy_kwh")));
    assertEquals(List.of("asset_id", "time_max", "energy_kwh_std"), s.names());
    assertEquals(ColumnType.TIMESTAMP, s.typeOf("time_max"));
    assertThrows(SchemaException.class, () -> v.validateGroupAggregate(METER, GroupBy.global(), List.of()));
    assertThrows(SchemaException.class,
        () -> v.validateGroupAggregate(METER, GroupBy.global(), List.of(Aggregation.max("ok"))));
  }
}
