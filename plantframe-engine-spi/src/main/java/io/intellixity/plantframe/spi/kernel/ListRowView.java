package io.intellixity.plantframe.spi.kernel;

import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.RowView;

import java.util.List;

/** Reusable {@link RowView} over positional rows; not thread-safe, one per task. */
final class ListRowView implements RowView {
  private final FrameSchema schema;
  private List<Object> row;

  ListRowView(FrameSchema schema) {
    this.schema = schema;
  }

  ListRowView at(List<Object> r) {
    this.row = r;
    return this;
  }

  @Override
  public FrameSchema schema() {
    return schema;
  }

  @Override
  public Object get(String column) {
    return row.get(schema.require(column));
  }
}
