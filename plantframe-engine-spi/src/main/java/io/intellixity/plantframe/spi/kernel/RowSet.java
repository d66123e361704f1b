package io.intellixity.plantframe.spi.kernel;

import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.MaterializedFrame;

import java.util.List;
import java.util.Objects;

/** Engine-internal batch of rows; rows are positional lists matching {@code schema}. */
public record RowSet(FrameSchema schema, List<List<Object>> rows) {
  public RowSet {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(rows, "rows");
  }

  public static RowSet of(MaterializedFrame frame) {
    return new RowSet(frame.schema(), frame.rows());
  }

  public int size() {
    return rows.size();
  }

  public MaterializedFrame toFrame() {
    return MaterializedFrame.trusted(schema, rows);
  }
}
