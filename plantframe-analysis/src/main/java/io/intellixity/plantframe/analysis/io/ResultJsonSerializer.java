package io.intellixity.plantframe.analysis.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.plantframe.analysis.run.Provenance;
import io.intellixity.plantframe.analysis.run.Result;
import io.intellixity.plantframe.analysis.run.ToolkitDiagnostic;
import io.intellixity.plantframe.exec.EngineDescriptor;
import io.intellixity.plantframe.frame.Column;
import io.intellixity.plantframe.frame.DatasetRef;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** JSON form of a {@link Result}. Timestamps are ISO-8601, NaN and infinities are written as null. */
public final class ResultJsonSerializer extends JsonSerializer<Result> {
  @Override
  public void serialize(Result r, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (r == null) {
      g.writeNull();
      return;
    }
    g.writeStartObject();
    g.writeFieldName("provenance");
    writeProvenance(r.provenance(), g, serializers);

    g.writeArrayFieldStart("columns");
    for (Column c : r.payload().schema().columns()) {
      g.writeStartObject();
      g.writeStringField("name", c.name());
      g.writeStringField("type", c.type().name());
      g.writeEndObject();
    }
    g.writeEndArray();

    g.writeArrayFieldStart("rows");
    for (List<Object> row : r.payload().rows()) {
      g.writeStartArray();
      for (Object v : row) writeValue(v, g, serializers);
      g.writeEndArray();
    }
    g.writeEndArray();

    g.writeArrayFieldStart("diagnostics");
    for (ToolkitDiagnostic d : r.diagnostics()) {
      g.writeStartObject();
      g.writeStringField("toolkit", d.toolkit().name());
      g.writeStringField("version", d.toolkit().version());
      g.writeFieldName("params");
      writeMap(d.params(), g, serializers);
      writeStrings("inputColumns", d.inputColumns(), g);
      writeStrings("outputColumns", d.outputColumns(), g);
      g.writeNumberField("durationMillis", d.durationMillis());
      g.writeEndObject();
    }
    g.writeEndArray();

    writeStrings("warnings", r.warnings(), g);

    g.writeObjectFieldStart("usage");
    g.writeNumberField("wallClockMillis", r.usage().wallClockMillis());
    g.writeNumberField("engineJobs", r.usage().engineJobs());
    g.writeNumberField("rowsMaterialized", r.usage().rowsMaterialized());
    g.writeEndObject();
    g.writeEndObject();
  }

  private static void writeProvenance(Provenance p, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeStartObject();
    g.writeStringField("runId", p.runId());
    g.writeStringField("method", p.method().name());
    g.writeStringField("methodVersion", p.method().version());

    EngineDescriptor e = p.engine();
    g.writeObjectFieldStart("engine");
    g.writeStringField("id", e.id());
    g.writeStringField("variant", e.variant());
    g.writeStringField("mode", e.mode().name());
    g.writeNumberField("workers", e.limits().workers());
    g.writeNumberField("maxConcurrentJobs", e.limits().maxConcurrentJobs());
    g.writeNumberField("memoryBudgetCells", e.limits().memoryBudgetCells());
    g.writeEndObject();

    g.writeFieldName("parameters");
    writeMap(p.parameters(), g, serializers);

    g.writeObjectFieldStart("datasets");
    for (Map.Entry<String, List<DatasetRef>> en : p.datasets().entrySet()) {
      g.writeArrayFieldStart(en.getKey());
      for (DatasetRef ref : en.getValue()) {
        g.writeStartObject();
        g.writeStringField("name", ref.name());
        g.writeStringField("version", ref.version());
        g.writeEndObject();
      }
      g.writeEndArray();
    }
    g.writeEndObject();

    g.writeFieldName("startedAt");
    writeValue(p.startedAt(), g, serializers);
    g.writeFieldName("finishedAt");
    writeValue(p.finishedAt(), g, serializers);
    g.writeEndObject();
  }

  private static void writeMap(Map<String, Object> m, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeStartObject();
    for (Map.Entry<String, Object> en : m.entrySet()) {
      g.writeFieldName(en.getKey());
      writeValue(en.getValue(), g, serializers);
    }
    g.writeEndObject();
  }

  private static void writeStrings(String field, List<String> values, JsonGenerator g) throws IOException {
    g.writeArrayFieldStart(field);
    for (String s : values) g.writeString(s);
    g.writeEndArray();
  }

  private static void writeValue(Object v, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (v == null) {
      g.writeNull();
    } else if (v instanceof Instant i) {
      g.writeString(i.toString());
    } else if (v instanceof Double d && (d.isNaN() || d.isInfinite())) {
      g.writeNull();
    } else {
      serializers.defaultSerializeValue(v, g);
    }
  }
}
