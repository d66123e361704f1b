package io.intellixity.plantframe.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class FilterJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesNotNode() throws Exception {
    String s = """
        {
          "not": { "eq": { "field": "turbine_id", "value": "T01" } }
        }
        """;
    Filter f = JSON.readValue(s, Filter.class);
    assertTrue(f.root() instanceof NotElement);
    NotElement n = (NotElement) f.root();
    assertTrue(n.element() instanceof Condition);
    Condition c = (Condition) n.element();
    assertEquals("turbine_id", c.column());
    assertEquals(Operator.EQ, c.operator());
    assertEquals("T01", c.value());
  }

  @Test
  void parsesGroupWithRangeInAndIsNull() throws Exception {
    String s = """
        {
          "and": [
            { "gt": { "field": "power_kw", "value": 0 } },
            { "range": { "field": "windspeed_ms", "lower": 3.5, "upper": 25 } },
            { "in": { "field": "turbine_id", "values": ["T01", "T02"] } },
            { "is_null": { "field": "curtailment_kwh", "not": true } }
          ]
        }
        """;
    Filter f = JSON.readValue(s, Filter.class);
    LogicalGroup g = (LogicalGroup) f.root();
    assertEquals(Clause.AND, g.clause());
    assertEquals(4, g.elements().size());

    Condition gt = (Condition) g.elements().get(0);
    assertEquals(0L, gt.value());

    Condition range = (Condition) g.elements().get(1);
    assertEquals(3.5, range.lower());
    assertEquals(25L, range.upper());

    Condition in = (Condition) g.elements().get(2);
    assertEquals(List.of("T01", "T02"), in.values());

    Condition isNull = (Condition) g.elements().get(3);
    assertEquals(Operator.IS_NULL, isNull.operator());
    assertTrue(isNull.not());
  }

  @Test
  void writesCanonicalFormAndReadsItBack() throws Exception {
    Filter f = Filter.of(Filters.or(
        Filters.and(Filters.ge("power_kw", 0.0), Filters.notNull("energy_kwh")),
        Filters.not(Filters.like("turbine_id", "T0%"))));

    String json = JSON.writeValueAsString(f);
    assertEquals("{\"or\":[{\"and\":[{\"ge\":{\"field\":\"power_kw\",\"value\":0.0}},"
        + "{\"is_null\":{\"field\":\"energy_kwh\",\"not\":true}}]},"
        + "{\"not\":{\"like\":{\"field\":\"turbine_id\",\"value\":\"T0%\"}}}]}", json);

    assertEquals(f, JSON.readValue(json, Filter.class));
  }

  @Test
  void rowConditionsCannotBeWritten() {
    Filter f = Filter.of(Filters.row(List.of("power_kw"), r -> r.getDouble("power_kw") > 0));
    Exception e = assertThrows(Exception.class, () -> JSON.writeValueAsString(f));
    assertTrue(e.getMessage().contains("cannot be written as JSON"), e.getMessage());
  }

  @Test
  void rejectsUnknownElement() {
    assertThrows(Exception.class, () -> JSON.readValue("{\"between\":{\"field\":\"x\"}}", Filter.class));
  }
}
