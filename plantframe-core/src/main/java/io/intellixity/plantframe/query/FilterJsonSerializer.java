package io.intellixity.plantframe.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.time.Instant;

/** Canonical JSON serializer for {@link Filter}. */
public final class FilterJsonSerializer extends JsonSerializer<Filter> {
  @Override
  public void serialize(Filter f, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (f == null) {
      g.writeNull();
      return;
    }
    writeElement(f.root(), g, serializers);
  }

  private static void writeElement(FilterElement el, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (el instanceof LogicalGroup lg) {
      String key = lg.clause() == Clause.OR ? "or" : "and";
      g.writeStartObject();
      g.writeArrayFieldStart(key);
      for (FilterElement child : lg.elements()) {
        writeElement(child, g, serializers);
      }
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (el instanceof NotElement n) {
      g.writeStartObject();
      g.writeFieldName("not");
      writeElement(n.element(), g, serializers);
      g.writeEndObject();
      return;
    }

    if (el instanceof Condition c) {
      String opKey = c.operator().name().toLowerCase();
      g.writeStartObject();
      g.writeObjectFieldStart(opKey);
      g.writeStringField("field", c.column());
      if (c.not()) g.writeBooleanField("not", true);
      if (c.operator() == Operator.RANGE) {
        g.writeFieldName("lower");
        writeValue(c.lower(), g, serializers);
        g.writeFieldName("upper");
        writeValue(c.upper(), g, serializers);
      } else if (c.operator().takesCollection()) {
        g.writeArrayFieldStart("values");
        for (Object v : c.values()) writeValue(v, g, serializers);
        g.writeEndArray();
      } else if (c.operator() != Operator.IS_NULL) {
        g.writeFieldName("value");
        writeValue(c.value(), g, serializers);
      }
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    if (el instanceof RowCondition r) {
      throw new IllegalArgumentException("Row condition '" + r.description() + "' cannot be written as JSON");
    }
    throw new IllegalArgumentException("Unsupported filter element: " + el);
  }

  private static void writeValue(Object v, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (v instanceof Instant i) {
      g.writeString(i.toString());
      return;
    }
    serializers.defaultSerializeValue(v, g);
  }
}
