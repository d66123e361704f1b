package io.intellixity.plantframe.analysis.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.intellixity.plantframe.error.ConfigValidationException;
import io.intellixity.plantframe.exec.ResourceLimits;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.*;

/**
 * Reads a {@link SessionConfig} from YAML:\n
 *
 * <pre>
 * engine:
 *   variant: partitioned
 *   id: plant-a
 *   workers: 4
 *   max-concurrent-jobs: 2
 *   memory-budget-cells: 5000000
 *   zone: Europe/Paris
 *   options:
 *     partitions: 8
 * </pre>
 *
 * Missing keys take the {@link ResourceLimits#defaults()}. Unknown keys are rejected.\n
 */
public final class SessionConfigLoader {
  private static final Set<String> ROOT_KEYS = Set.of("engine");
  private static final Set<String> ENGINE_KEYS =
      Set.of("variant", "id", "workers", "max-concurrent-jobs", "memory-budget-cells", "zone", "options");

  private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

  public SessionConfig load(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read session config " + file, e);
    }
  }

  /** Classpath resource, e.g. {@code plantframe-session.yaml}. */
  public SessionConfig loadResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = SessionConfigLoader.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new ConfigValidationException("Session config resource not found: " + resource);
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read session config resource " + resource, e);
    }
  }

  public SessionConfig load(InputStream in) throws IOException {
    return fromTree(yaml.readTree(in));
  }

  public SessionConfig parse(String text) {
    try {
      return fromTree(yaml.readTree(text));
    } catch (JsonProcessingException e) {
      throw new ConfigValidationException("Malformed session config: " + e.getOriginalMessage(), e);
    }
  }

  private SessionConfig fromTree(JsonNode root) {
    if (root == null || root.isNull() || root.isMissingNode()) return SessionConfig.local();
    if (!root.isObject()) throw new ConfigValidationException("Session config must be a mapping");
    rejectUnknown(root, ROOT_KEYS, "session config");

    JsonNode engine = root.get("engine");
    if (engine == null || engine.isNull()) return SessionConfig.local();
    if (!engine.isObject()) throw new ConfigValidationException("'engine' must be a mapping");
    rejectUnknown(engine, ENGINE_KEYS, "engine");

    ResourceLimits d = ResourceLimits.defaults();
    ResourceLimits limits;
    try {
      limits = new ResourceLimits(
          intValue(engine, "workers", d.workers()),
          intValue(engine, "max-concurrent-jobs", d.maxConcurrentJobs()),
          longValue(engine, "memory-budget-cells", d.memoryBudgetCells()));
    } catch (IllegalArgumentException e) {
      throw new ConfigValidationException("Invalid engine limits: " + e.getMessage(), e);
    }

    ZoneId zone = null;
    String z = text(engine, "zone");
    if (z != null) {
      try {
        zone = ZoneId.of(z);
      } catch (DateTimeException e) {
        throw new ConfigValidationException("Unknown zone '" + z + "'", e);
      }
    }

    Map<String, String> options = new LinkedHashMap<>();
    JsonNode opts = engine.get("options");
    if (opts != null && !opts.isNull()) {
      if (!opts.isObject()) throw new ConfigValidationException("'engine.options' must be a mapping");
      Iterator<Map.Entry<String, JsonNode>> it = opts.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        if (!e.getValue().isValueNode()) {
          throw new ConfigValidationException("Engine option '" + e.getKey() + "' must be a scalar");
        }
        options.put(e.getKey(), e.getValue().asText());
      }
    }

    return new SessionConfig(text(engine, "variant"), text(engine, "id"), limits, zone, options);
  }

  private static void rejectUnknown(JsonNode node, Set<String> known, String where) {
    List<String> unknown = new ArrayList<>();
    node.fieldNames().forEachRemaining(k -> {
      if (!known.contains(k)) unknown.add(k);
    });
    if (!unknown.isEmpty()) {
      throw new ConfigValidationException("Unrecognised keys in " + where + ": " + unknown + "; recognised: "
          + new TreeSet<>(known));
    }
  }

  private static String text(JsonNode n, String key) {
    JsonNode v = n.get(key);
    if (v == null || v.isNull()) return null;
    if (!v.isValueNode()) throw new ConfigValidationException("'" + key + "' must be a scalar");
    String s = v.asText().trim();
    return s.isEmpty() ? null : s;
  }

  private static int intValue(JsonNode n, String key, int def) {
    long v = longValue(n, key, def);
    if (v > Integer.MAX_VALUE) throw new ConfigValidationException("'" + key + "' is too large: " + v);
    return (int) v;
  }

  private static long longValue(JsonNode n, String key, long def) {
    JsonNode v = n.get(key);
    if (v == null || v.isNull()) return def;
    if (!v.canConvertToLong() || !v.isIntegralNumber()) {
      throw new ConfigValidationException("'" + key + "' must be an integer, got " + v);
    }
    return v.asLong();
  }
}
