package io.intellixity.plantframe.exec;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.*;

/**
 * Everything a {@link BackendEngineProvider} needs to build an engine instance.
 *
 * @param variant provider variant id
 * @param engineId instance id; generated when blank
 * @param zone default zone for resample alignment
 * @param options variant-specific options (e.g. {@code preserve-order} for the cluster engine)
 */
public record EngineSettings(String variant,
                             String engineId,
                             ResourceLimits limits,
                             ZoneId zone,
                             Map<String, String> options) {
  public EngineSettings {
    if (variant == null || variant.isBlank()) throw new IllegalArgumentException("variant is required");
    variant = variant.trim();
    if (engineId == null || engineId.isBlank()) engineId = variant + "-" + UUID.randomUUID().toString().substring(0, 8);
    limits = limits == null ? ResourceLimits.defaults() : limits;
    zone = zone == null ? ZoneOffset.UTC : zone;
    options = Collections.unmodifiableMap(new LinkedHashMap<>(options == null ? Map.of() : options));
  }

  public static EngineSettings of(String variant) {
    return new EngineSettings(variant, null, null, null, null);
  }

  public static EngineSettings of(String variant, ResourceLimits limits) {
    return new EngineSettings(variant, null, limits, null, null);
  }

  public EngineSettings withOption(String key, String value) {
    Map<String, String> m = new LinkedHashMap<>(options);
    m.put(key, value);
    return new EngineSettings(variant, engineId, limits, zone, m);
  }

  public EngineSettings withZone(ZoneId z) {
    return new EngineSettings(variant, engineId, limits, z, options);
  }

  public String option(String key, String def) {
    String v = options.get(key);
    return (v == null || v.isBlank()) ? def : v.trim();
  }

  public boolean booleanOption(String key, boolean def) {
    String v = options.get(key);
    return (v == null || v.isBlank()) ? def : Boolean.parseBoolean(v.trim());
  }

  public int intOption(String key, int def) {
    String v = options.get(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Engine option '" + key + "' must be an integer: " + v, e);
    }
  }
}
