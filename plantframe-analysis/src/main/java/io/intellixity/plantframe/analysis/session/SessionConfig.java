package io.intellixity.plantframe.analysis.session;

import io.intellixity.plantframe.exec.EngineSettings;
import io.intellixity.plantframe.exec.ResourceLimits;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine selection of an {@link AnalysisSession}.
 *
 * @param variant engine variant ({@code local}, {@code partitioned}, {@code cluster})
 * @param engineId optional instance id; generated when null
 * @param zone default zone for calendar resampling
 * @param options variant-specific engine options
 */
public record SessionConfig(String variant,
                            String engineId,
                            ResourceLimits limits,
                            ZoneId zone,
                            Map<String, String> options) {
  public static final String DEFAULT_VARIANT = "local";

  public SessionConfig {
    if (variant == null || variant.isBlank()) variant = DEFAULT_VARIANT;
    limits = limits == null ? ResourceLimits.defaults() : limits;
    zone = zone == null ? ZoneOffset.UTC : zone;
    options = Collections.unmodifiableMap(new LinkedHashMap<>(options == null ? Map.of() : options));
  }

  public static SessionConfig local() {
    return of(DEFAULT_VARIANT);
  }

  public static SessionConfig of(String variant) {
    return new SessionConfig(variant, null, null, null, null);
  }

  public static SessionConfig of(String variant, ResourceLimits limits) {
    return new SessionConfig(variant, null, limits, null, null);
  }

  public SessionConfig withOption(String key, String value) {
    Map<String, String> m = new LinkedHashMap<>(options);
    m.put(key, value);
    return new SessionConfig(variant, engineId, limits, zone, m);
  }

  public SessionConfig withZone(ZoneId z) {
    return new SessionConfig(variant, engineId, limits, z, options);
  }

  public EngineSettings toEngineSettings() {
    return new EngineSettings(variant, engineId, limits, zone, options);
  }
}
