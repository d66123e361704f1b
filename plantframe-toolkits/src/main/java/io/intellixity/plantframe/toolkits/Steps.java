package io.intellixity.plantframe.toolkits;

import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.frame.ColumnType;
import io.intellixity.plantframe.frame.SchemaContract;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import io.intellixity.plantframe.time.Frequency;
import io.intellixity.plantframe.toolkit.ToolkitParams;

import java.time.ZoneId;
import java.util.List;

/** Step helpers shared by the built-in toolkits. */
final class Steps {
  static final String TIME = "time";
  static final String PARAM_FREQUENCY = "frequency";
  static final String PARAM_ZONE = "zone";

  private Steps() {}

  /** Resample on {@code time} with the {@code frequency} and optional {@code zone} parameters. */
  static ComputationHandle resample(ComputationHandle h, ToolkitParams p, Aggregation... aggregations) {
    Frequency f = Frequency.parse(p.getString(PARAM_FREQUENCY, "MS"));
    ZoneId zone = p.has(PARAM_ZONE) ? ZoneId.of(p.requireString(PARAM_ZONE)) : h.engine().defaultZone();
    return h.resample(TIME, f, List.of(aggregations), zone);
  }

  /** Contract check for a column chosen by parameter. */
  static void requireColumn(ComputationHandle h, String column, ColumnType type, String toolkit) {
    SchemaContract.builder().require(column, type).build().check(h.schema(), "Input of toolkit " + toolkit);
  }
}
