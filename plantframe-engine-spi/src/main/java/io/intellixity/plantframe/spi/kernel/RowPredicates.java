package io.intellixity.plantframe.spi.kernel;

import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.Values;
import io.intellixity.plantframe.query.*;

import java.util.*;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Compiles a validated filter tree into a row predicate.\n
 *
 * Comparisons against a missing value are false; EQ/NE against null mean "is missing" / "is present".\n
 * The returned predicate is stateless except for row conditions, so compile once per task.\n
 */
public final class RowPredicates {
  private RowPredicates() {}

  public static Predicate<List<Object>> compile(FilterElement filter, FrameSchema schema) {
    Objects.requireNonNull(filter, "filter");
    return filter.accept(new FilterVisitor<Predicate<List<Object>>>() {
      @Override
      public Predicate<List<Object>> visit(Condition c) {
        Predicate<List<Object>> p = condition(c, schema.require(c.column()));
        return c.not() ? p.negate() : p;
      }

      @Override
      public Predicate<List<Object>> visit(LogicalGroup g) {
        List<Predicate<List<Object>>> parts = new ArrayList<>(g.elements().size());
        for (FilterElement e : g.elements()) parts.add(e.accept(this));
        if (g.clause() == Clause.OR) {
          return row -> {
            for (Predicate<List<Object>> p : parts) if (p.test(row)) return true;
            return false;
          };
        }
        return row -> {
          for (Predicate<List<Object>> p : parts) if (!p.test(row)) return false;
          return true;
        };
      }

      @Override
      public Predicate<List<Object>> visit(NotElement n) {
        return n.element().accept(this).negate();
      }

      @Override
      public Predicate<List<Object>> visit(RowCondition r) {
        ListRowView view = new ListRowView(schema);
        return row -> r.test(view.at(row));
      }
    });
  }

  private static Predicate<List<Object>> condition(Condition c, int idx) {
    Object operand = c.value();
    switch (c.operator()) {
      case IS_NULL:
        return row -> Values.isMissing(row.get(idx));
      case EQ:
        if (operand == null) return row -> Values.isMissing(row.get(idx));
        return row -> Values.sameValue(row.get(idx), operand);
      case NE:
        if (operand == null) return row -> !Values.isMissing(row.get(idx));
        return row -> {
          Object v = row.get(idx);
          return !Values.isMissing(v) && !Values.sameValue(v, operand);
        };
      case GT:
        return row -> present(row.get(idx)) && Values.compare(row.get(idx), operand) > 0;
      case GE:
        return row -> present(row.get(idx)) && Values.compare(row.get(idx), operand) >= 0;
      case LT:
        return row -> present(row.get(idx)) && Values.compare(row.get(idx), operand) < 0;
      case LE:
        return row -> present(row.get(idx)) && Values.compare(row.get(idx), operand) <= 0;
      case RANGE: {
        Object lo = c.lower();
        Object hi = c.upper();
        return row -> {
          Object v = row.get(idx);
          return present(v) && Values.compare(v, lo) >= 0 && Values.compare(v, hi) <= 0;
        };
      }
      case IN: {
        Collection<?> vs = c.values();
        return row -> {
          Object v = row.get(idx);
          if (!present(v)) return false;
          for (Object x : vs) if (Values.sameValue(v, x)) return true;
          return false;
        };
      }
      case NIN: {
        Collection<?> vs = c.values();
        return row -> {
          Object v = row.get(idx);
          if (!present(v)) return false;
          for (Object x : vs) if (Values.sameValue(v, x)) return false;
          return true;
        };
      }
      case LIKE: {
        Pattern p = likePattern(String.valueOf(operand));
        return row -> {
          Object v = row.get(idx);
          return present(v) && p.matcher(v.toString()).matches();
        };
      }
      default:
        throw new IllegalArgumentException("Unsupported operator " + c.operator());
    }
  }

  private static boolean present(Object v) {
    return !Values.isMissing(v);
  }

  static Pattern likePattern(String like) {
    StringBuilder sb = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    for (int i = 0; i < like.length(); i++) {
      char ch = like.charAt(i);
      if (ch == '%' || ch == '_') {
        if (literal.length() > 0) {
          sb.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        sb.append(ch == '%' ? ".*" : ".");
      } else {
        literal.append(ch);
      }
    }
    if (literal.length() > 0) sb.append(Pattern.quote(literal.toString()));
    return Pattern.compile(sb.toString(), Pattern.DOTALL);
  }
}
