package io.intellixity.plantframe.toolkits;

import io.intellixity.plantframe.frame.ColumnType;
import io.intellixity.plantframe.frame.SchemaContract;
import io.intellixity.plantframe.query.Filters;
import io.intellixity.plantframe.toolkit.PipelineToolkit;
import io.intellixity.plantframe.toolkit.Toolkit;
import io.intellixity.plantframe.toolkit.ToolkitParams;
import io.intellixity.plantframe.toolkits.functions.Flags;

/** Data quality flags and flag-based filtering. Column names are parameters, so the input contract is checked per call. */
public final class QualityToolkits {
  public static final String RANGE_FLAG = "range-flag";
  public static final String WINDOW_RANGE_FLAG = "window-range-flag";
  public static final String FLAG_FILTER = "flag-filter";

  public static final String PARAM_COLUMN = "column";
  public static final String PARAM_BELOW = "below";
  public static final String PARAM_ABOVE = "above";
  public static final String PARAM_FLAG_COLUMN = "flag_column";
  public static final String PARAM_WINDOW_COLUMN = "window_column";
  public static final String PARAM_WINDOW_START = "window_start";
  public static final String PARAM_WINDOW_END = "window_end";
  public static final String PARAM_VALUE_COLUMN = "value_column";
  public static final String PARAM_VALUE_MIN = "value_min";
  public static final String PARAM_VALUE_MAX = "value_max";

  private QualityToolkits() {}

  public static Toolkit rangeFlag() {
    return PipelineToolkit.builder(RANGE_FLAG, BuiltinToolkits.VERSION)
        .description("Flag values below 'below' or above 'above'")
        .requires(SchemaContract.none())
        .defaults(ToolkitParams.of(PARAM_FLAG_COLUMN, "range_flag"))
        .step("flag", (h, p) -> {
          String column = p.requireString(PARAM_COLUMN);
          Steps.requireColumn(h, column, ColumnType.DOUBLE, RANGE_FLAG);
          double below = p.getDouble(PARAM_BELOW, Double.NEGATIVE_INFINITY);
          double above = p.getDouble(PARAM_ABOVE, Double.POSITIVE_INFINITY);
          return h.derive(p.requireString(PARAM_FLAG_COLUMN), ColumnType.BOOLEAN,
              r -> Flags.outsideRange(r.getDouble(column), below, above));
        })
        .build();
  }

  public static Toolkit windowRangeFlag() {
    return PipelineToolkit.builder(WINDOW_RANGE_FLAG, BuiltinToolkits.VERSION)
        .description("Flag values outside [value_min, value_max] while the window column lies in [window_start, window_end]")
        .requires(SchemaContract.none())
        .defaults(ToolkitParams.of(PARAM_FLAG_COLUMN, "window_flag"))
        .step("flag", (h, p) -> {
          String window = p.requireString(PARAM_WINDOW_COLUMN);
          String value = p.requireString(PARAM_VALUE_COLUMN);
          Steps.requireColumn(h, window, ColumnType.DOUBLE, WINDOW_RANGE_FLAG);
          Steps.requireColumn(h, value, ColumnType.DOUBLE, WINDOW_RANGE_FLAG);
          double ws = p.requireDouble(PARAM_WINDOW_START);
          double we = p.requireDouble(PARAM_WINDOW_END);
          double vmin = p.getDouble(PARAM_VALUE_MIN, Double.NEGATIVE_INFINITY);
          double vmax = p.getDouble(PARAM_VALUE_MAX, Double.POSITIVE_INFINITY);
          return h.derive(p.requireString(PARAM_FLAG_COLUMN), ColumnType.BOOLEAN,
              r -> Flags.windowRange(r.getDouble(window), ws, we, r.getDouble(value), vmin, vmax));
        })
        .build();
  }

  /** Keeps rows whose flag is false or missing. */
  public static Toolkit flagFilter() {
    return PipelineToolkit.builder(FLAG_FILTER, BuiltinToolkits.VERSION)
        .description("Drop rows whose flag column is true")
        .requires(SchemaContract.none())
        .step("filter", (h, p) -> {
          String flag = p.requireString(PARAM_FLAG_COLUMN);
          Steps.requireColumn(h, flag, ColumnType.BOOLEAN, FLAG_FILTER);
          return h.filter(Filters.not(Filters.eq(flag, true)));
        })
        .build();
  }
}
