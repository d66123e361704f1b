package io.intellixity.plantframe.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link Filter}.\n
 *
 * Timestamps arrive as ISO-8601 strings; engines coerce operands to the column type at validation time.\n
 */
public final class FilterJsonDeserializer extends JsonDeserializer<Filter> {
  @Override
  public Filter deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Filter JSON must be an object");
    return new Filter(parseElement(root, codec));
  }

  private static FilterElement parseElement(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull() || !n.isObject()) throw new IllegalArgumentException("Unsupported filter element: " + n);

    // Canonical group forms: { "and": [ ... ] } / { "or": [ ... ] }
    if (n.has("and")) {
      return new LogicalGroup(Clause.AND, parseChildren(n.get("and"), codec));
    }
    if (n.has("or")) {
      return new LogicalGroup(Clause.OR, parseChildren(n.get("or"), codec));
    }

    if (n.has("not")) {
      return new NotElement(parseElement(n.get("not"), codec));
    }

    // { "eq": { field:..., value:..., not?:... } }
    Iterator<String> it = n.fieldNames();
    while (it.hasNext()) {
      String k = it.next();
      Operator op = tryOp(k);
      if (op == null) continue;
      JsonNode body = n.get(k);
      if (body == null || !body.isObject()) throw new IllegalArgumentException(k + " must be an object");
      return parseCondition(op, body, codec);
    }

    throw new IllegalArgumentException("Unsupported filter element: " + n);
  }

  private static List<FilterElement> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) throw new IllegalArgumentException("Logical group must hold an array: " + arr);
    List<FilterElement> out = new ArrayList<>();
    for (JsonNode x : arr) out.add(parseElement(x, codec));
    return out;
  }

  private static Condition parseCondition(Operator op, JsonNode body, ObjectCodec codec) throws IOException {
    String field = textOrNull(body.get("field"));
    if (field == null) throw new IllegalArgumentException(op + " requires field");
    boolean not = boolOrDefault(body.get("not"), false);

    if (op == Operator.RANGE) {
      Object lower = decodeValue(body.get("lower"), codec);
      Object upper = decodeValue(body.get("upper"), codec);
      return new Condition(field, op, null, lower, upper, not);
    }

    if (op.takesCollection()) {
      JsonNode values = body.get("values");
      if (values == null || !values.isArray()) throw new IllegalArgumentException(op + " requires a values array");
      List<Object> out = new ArrayList<>();
      for (JsonNode v : values) out.add(decodeValue(v, codec));
      return new Condition(field, op, out, null, null, not);
    }

    if (op == Operator.IS_NULL) {
      return new Condition(field, op, null, null, null, not);
    }

    return new Condition(field, op, decodeValue(body.get("value"), codec), null, null, not);
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    if (v.isIntegralNumber()) return v.longValue();
    if (v.isFloatingPointNumber()) return v.doubleValue();
    return codec.treeToValue(v, Object.class);
  }

  private static Operator tryOp(String key) {
    if (key == null) return null;
    for (Operator op : Operator.values()) {
      if (op.name().equalsIgnoreCase(key)) return op;
    }
    return null;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    if (n == null || n.isNull()) return def;
    return n.isBoolean() ? n.booleanValue() : Boolean.parseBoolean(n.asText());
  }
}
