package io.intellixity.plantframe.frame;

import io.intellixity.plantframe.error.SchemaException;

import java.util.*;

/**
 * Immutable, engine-independent snapshot of a computation result.\n
 *
 * Equality is row-by-row and column-by-column; doubles compare by bit pattern ({@link Double#equals}), so two
 * frames are equal only when they are bit-identical.\n
 */
public final class MaterializedFrame {
  private final FrameSchema schema;
  private final List<List<Object>> rows;

  private MaterializedFrame(FrameSchema schema, List<List<Object>> rows) {
    this.schema = schema;
    this.rows = rows;
  }

  /** Build a frame from raw rows, coercing each value to its column type. */
  public static MaterializedFrame of(FrameSchema schema, List<? extends List<?>> rows) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(rows, "rows");
    List<List<Object>> out = new ArrayList<>(rows.size());
    for (List<?> r : rows) out.add(coerceRow(schema, r, out.size()));
    return new MaterializedFrame(schema, Collections.unmodifiableList(out));
  }

  /** Wrap rows already produced by an engine (values are trusted to match the schema). */
  public static MaterializedFrame trusted(FrameSchema schema, List<List<Object>> rows) {
    Objects.requireNonNull(schema, "schema");
    List<List<Object>> out = new ArrayList<>(rows.size());
    for (List<Object> r : rows) out.add(Collections.unmodifiableList(Arrays.asList(r.toArray())));
    return new MaterializedFrame(schema, Collections.unmodifiableList(out));
  }

  public static MaterializedFrame empty(FrameSchema schema) {
    return new MaterializedFrame(Objects.requireNonNull(schema, "schema"), List.of());
  }

  public static Builder builder(FrameSchema schema) {
    return new Builder(schema);
  }

  public FrameSchema schema() { return schema; }
  public List<List<Object>> rows() { return rows; }
  public int rowCount() { return rows.size(); }
  public boolean isEmpty() { return rows.isEmpty(); }

  /** Number of cells (rows x columns), used for memory budgeting. */
  public long cellCount() {
    return (long) rows.size() * schema.size();
  }

  public List<Object> row(int i) {
    return rows.get(i);
  }

  public Object value(int row, String column) {
    return rows.get(row).get(schema.require(column));
  }

  public double doubleValue(int row, String column) {
    Object v = value(row, column);
    return v == null ? Double.NaN : ((Number) v).doubleValue();
  }

  public List<Object> column(String name) {
    int idx = schema.require(name);
    List<Object> out = new ArrayList<>(rows.size());
    for (List<Object> r : rows) out.add(r.get(idx));
    return Collections.unmodifiableList(out);
  }

  public RowView rowView(int i) {
    List<Object> r = rows.get(i);
    return new RowView() {
      @Override public FrameSchema schema() { return schema; }
      @Override public Object get(String column) { return r.get(schema.require(column)); }
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof MaterializedFrame other)) return false;
    return schema.equals(other.schema) && rows.equals(other.rows);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schema, rows);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("MaterializedFrame").append(schema).append(" rows=").append(rows.size());
    int shown = Math.min(rows.size(), 5);
    for (int i = 0; i < shown; i++) sb.append("\n  ").append(rows.get(i));
    if (rows.size() > shown) sb.append("\n  ...");
    return sb.toString();
  }

  private static List<Object> coerceRow(FrameSchema schema, List<?> raw, int rowIndex) {
    if (raw == null || raw.size() != schema.size()) {
      throw new SchemaException("Row " + rowIndex + " has " + (raw == null ? 0 : raw.size())
          + " values; schema " + schema + " expects " + schema.size());
    }
    Object[] out = new Object[raw.size()];
    for (int i = 0; i < out.length; i++) {
      Column c = schema.columns().get(i);
      try {
        out[i] = c.type().coerce(raw.get(i));
      } catch (SchemaException e) {
        throw new SchemaException("Row " + rowIndex + ", column '" + c.name() + "': " + e.getMessage(), e);
      }
    }
    return Collections.unmodifiableList(Arrays.asList(out));
  }

  public static final class Builder {
    private final FrameSchema schema;
    private final List<List<Object>> rows = new ArrayList<>();

    private Builder(FrameSchema schema) {
      this.schema = Objects.requireNonNull(schema, "schema");
    }

    public Builder row(Object... values) {
      rows.add(Arrays.asList(values));
      return this;
    }

    public Builder row(List<?> values) {
      rows.add(new ArrayList<>(values));
      return this;
    }

    public MaterializedFrame build() {
      return MaterializedFrame.of(schema, rows);
    }
  }
}
