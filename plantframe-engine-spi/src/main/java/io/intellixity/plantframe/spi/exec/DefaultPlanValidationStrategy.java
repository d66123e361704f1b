package io.intellixity.plantframe.spi.exec;

import io.intellixity.plantframe.error.SchemaException;
import io.intellixity.plantframe.frame.Column;
import io.intellixity.plantframe.frame.ColumnType;
import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.plan.JoinType;
import io.intellixity.plantframe.query.*;
import io.intellixity.plantframe.query.aggregation.AggFunction;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import io.intellixity.plantframe.query.aggregation.GroupBy;

import java.util.*;

/**
 * Default, engine-agnostic operation validation.\n
 *
 * Validates:\n
 * - referenced columns exist\n
 * - filter operators fit the column type, operands are coerced to it\n
 * - aggregation inputs fit their reducer, output names are unique\n
 * - join keys exist on both sides with the same type, non-key names do not collide\n
 *
 * Violations throw {@link SchemaException}.\n
 */
public final class DefaultPlanValidationStrategy implements PlanValidationStrategy {
  @Override
  public FrameSchema validateSelect(FrameSchema input, List<String> columns) {
    if (columns == null || columns.isEmpty()) throw new SchemaException("select requires at least one column");
    if (new HashSet<>(columns).size() != columns.size()) throw new SchemaException("Duplicate column in select " + columns);
    return input.select(columns);
  }

  @Override
  public FilterElement validateFilter(FrameSchema input, FilterElement predicate) {
    Objects.requireNonNull(predicate, "predicate");
    return predicate.accept(new FilterVisitor<FilterElement>() {
      @Override
      public FilterElement visit(Condition c) {
        return validateCondition(input, c);
      }

      @Override
      public FilterElement visit(LogicalGroup g) {
        if (g.elements().isEmpty()) throw new SchemaException("Empty " + g.clause() + " group in filter");
        List<FilterElement> out = new ArrayList<>(g.elements().size());
        for (FilterElement e : g.elements()) out.add(e.accept(this));
        return new LogicalGroup(g.clause(), out);
      }

      @Override
      public FilterElement visit(NotElement n) {
        return new NotElement(n.element().accept(this));
      }

      @Override
      public FilterElement visit(RowCondition r) {
        for (String col : r.columns()) requireColumn(input, col, "filter");
        return r;
      }
    });
  }

  @Override
  public FrameSchema validateDerive(FrameSchema input, Column column) {
    Objects.requireNonNull(column, "column");
    return input.with(column);
  }

  @Override
  public FrameSchema validateRename(FrameSchema input, Map<String, String> mapping) {
    if (mapping == null || mapping.isEmpty()) throw new SchemaException("rename requires at least one mapping");
    for (Map.Entry<String, String> e : mapping.entrySet()) {
      requireColumn(input, e.getKey(), "rename");
      if (e.getValue() == null || e.getValue().isBlank()) {
        throw new SchemaException("Blank rename target for column '" + e.getKey() + "'");
      }
    }
    return input.rename(mapping);
  }

  @Override
  public FrameSchema validateResample(FrameSchema input, String timeColumn, List<Aggregation> aggregations) {
    Column time = requireColumn(input, timeColumn, "resample");
    if (time.type() != ColumnType.TIMESTAMP) {
      throw new SchemaException("resample time column '" + timeColumn + "' is " + time.type() + ", expected TIMESTAMP");
    }
    if (aggregations == null || aggregations.isEmpty()) throw new SchemaException("resample requires aggregations");
    List<Column> out = new ArrayList<>();
    out.add(time);
    addAggregationColumns(input, aggregations, out, "resample");
    return new FrameSchema(out);
  }

  @Override
  public FrameSchema validateJoin(FrameSchema left, FrameSchema right, List<String> on, JoinType how) {
    Objects.requireNonNull(how, "how");
    if (on == null || on.isEmpty()) throw new SchemaException("join requires at least one key column");
    if (new HashSet<>(on).size() != on.size()) throw new SchemaException("Duplicate join key in " + on);
    for (String k : on) {
      ColumnType lt = requireColumn(left, k, "join (left)").type();
      ColumnType rt = requireColumn(right, k, "join (right)").type();
      if (lt != rt) throw new SchemaException("Join key '" + k + "' is " + lt + " on the left and " + rt + " on the right");
    }
    List<Column> out = new ArrayList<>(left.columns());
    Set<String> keys = new HashSet<>(on);
    for (Column c : right.columns()) {
      if (keys.contains(c.name())) continue;
      if (left.has(c.name())) {
        throw new SchemaException("Join would produce duplicate column '" + c.name() + "'; rename one side first");
      }
      out.add(c);
    }
    return new FrameSchema(out);
  }

  @Override
  public FrameSchema validateGroupAggregate(FrameSchema input, GroupBy groupBy, List<Aggregation> aggregations) {
    Objects.requireNonNull(groupBy, "groupBy");
    List<Aggregation> aggs = aggregations == null ? List.of() : aggregations;
    if (groupBy.isGlobal() && aggs.isEmpty()) throw new SchemaException("group_aggregate needs keys or aggregations");
    List<Column> out = new ArrayList<>();
    for (String k : groupBy.keys()) out.add(requireColumn(input, k, "group_aggregate"));
    addAggregationColumns(input, aggs, out, "group_aggregate");
    return new FrameSchema(out);
  }

  private static void addAggregationColumns(FrameSchema input, List<Aggregation> aggs, List<Column> out, String usage) {
    Set<String> names = new HashSet<>();
    for (Column c : out) names.add(c.name());
    for (Aggregation a : aggs) {
      ColumnType inType = null;
      if (a.function().requiresColumn()) {
        inType = requireColumn(input, a.column(), usage).type();
        if (a.function().requiresNumeric() && !inType.isNumeric()) {
          throw new SchemaException(a.function() + " over non-numeric column '" + a.column() + "' (" + inType + ")");
        }
        if ((a.function() == AggFunction.MIN || a.function() == AggFunction.MAX) && !inType.isComparable()) {
          throw new SchemaException(a.function() + " over non-comparable column '" + a.column() + "' (" + inType + ")");
        }
      }
      if (!names.add(a.output())) throw new SchemaException("Duplicate output column '" + a.output() + "' in " + usage);
      out.add(new Column(a.output(), a.function().outputType(inType)));
    }
  }

  private static Column requireColumn(FrameSchema schema, String name, String usage) {
    if (name == null || name.isBlank()) throw new SchemaException("Blank column name in " + usage);
    if (!schema.has(name)) {
      throw new SchemaException("Unknown column '" + name + "' in " + usage + "; available: " + schema.names());
    }
    return schema.column(name);
  }

  private static Condition validateCondition(FrameSchema input, Condition c) {
    Column col = requireColumn(input, c.column(), "filter");
    ColumnType type = col.type();
    Operator op = c.operator();

    if (op.isOrdering() && !type.isComparable()) {
      throw new SchemaException(op + " is not supported on " + type + " column '" + col.name() + "'");
    }
    if (op == Operator.LIKE && type != ColumnType.STRING) {
      throw new SchemaException("LIKE requires a STRING column; '" + col.name() + "' is " + type);
    }

    switch (op) {
      case IS_NULL:
        return c;
      case RANGE:
        if (c.lower() == null || c.upper() == null) {
          throw new SchemaException("RANGE on '" + col.name() + "' requires both bounds");
        }
        return new Condition(c.column(), op, null, operand(col, c.lower()), operand(col, c.upper()), c.not());
      case IN:
      case NIN: {
        if (!(c.value() instanceof Collection<?>) && !(c.value() instanceof Object[])) {
          throw new SchemaException(op + " on '" + col.name() + "' requires a collection of values");
        }
        List<Object> vs = new ArrayList<>();
        for (Object v : c.values()) vs.add(operand(col, v));
        return new Condition(c.column(), op, vs, null, null, c.not());
      }
      case EQ:
      case NE:
        if (c.value() == null) return c;
        return new Condition(c.column(), op, operand(col, c.value()), null, null, c.not());
      default:
        if (c.value() == null) throw new SchemaException(op + " on '" + col.name() + "' requires a value");
        return new Condition(c.column(), op, operand(col, c.value()), null, null, c.not());
    }
  }

  private static Object operand(Column col, Object v) {
    if (v == null) throw new SchemaException("Null operand for column '" + col.name() + "'");
    ColumnType t = col.type();
    if (t.isNumeric()) {
      if (v instanceof Number) return v;
      throw new SchemaException("Operand " + v + " is not numeric for " + t + " column '" + col.name() + "'");
    }
    try {
      return t.coerce(v);
    } catch (SchemaException e) {
      throw new SchemaException("Operand for column '" + col.name() + "': " + e.getMessage(), e);
    }
  }
}
