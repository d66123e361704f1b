package io.intellixity.plantframe.analysis.session;

import io.intellixity.plantframe.error.ConfigValidationException;
import io.intellixity.plantframe.exec.EngineSettings;
import io.intellixity.plantframe.exec.ResourceLimits;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SessionConfigLoaderTest {
  private final SessionConfigLoader loader = new SessionConfigLoader();

  @Test
  void readsEngineSection() {
    SessionConfig c = loader.parse("""
        engine:
          variant: cluster
          id: plant-a
          workers: 3
          max-concurrent-jobs: 2
          memory-budget-cells: 5000000
          zone: Europe/Paris
          options:
            preserve-order: true
            partitions: 6
        """);
    assertEquals("cluster", c.variant());
    assertEquals(new ResourceLimits(3, 2, 5_000_000L), c.limits());
    assertEquals(ZoneId.of("Europe/Paris"), c.zone());
    assertEquals(Map.of("preserve-order", "true", "partitions", "6"), c.options());

    EngineSettings s = c.toEngineSettings();
    assertEquals("plant-a", s.engineId());
    assertTrue(s.booleanOption("preserve-order", false));
    assertEquals(6, s.intOption("partitions", 1));
  }

  @Test
  void classpathResourceIsLoaded() {
    SessionConfig c = loader.loadResource("session-partitioned.yaml");
    assertEquals("partitioned", c.variant());
    assertEquals(2, c.limits().workers());
    assertEquals(ZoneOffset.UTC, c.zone());
  }

  @Test
  void emptyDocumentMeansLocalDefaults() {
    SessionConfig c = loader.parse("");
    assertEquals(SessionConfig.DEFAULT_VARIANT, c.variant());
    assertEquals(ResourceLimits.defaults(), c.limits());
  }

  @Test
  void unknownKeysAreRejected() {
    ConfigValidationException e = assertThrows(ConfigValidationException.class,
        () -> loader.parse("engine:\n  variant: local\n  threads: 4\n"));
    assertTrue(e.getMessage().contains("threads"), e.getMessage());
    assertThrows(ConfigValidationException.class, () -> loader.parse("engines:\n  variant: local\n"));
  }

  @Test
  void malformedYamlIsAConfigError() {
    ConfigValidationException e = assertThrows(ConfigValidationException.class,
        () -> loader.parse("engine:\n  variant: [local\n"));
    assertTrue(e.getMessage().startsWith("Malformed session config"), e.getMessage());
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(ConfigValidationException.class, () -> loader.parse("engine:\n  workers: four\n"));
    assertThrows(ConfigValidationException.class, () -> loader.parse("engine:\n  workers: 0\n"));
    assertThrows(ConfigValidationException.class, () -> loader.parse("engine:\n  zone: Mars/Olympus\n"));
    assertThrows(ConfigValidationException.class, () -> loader.parse("engine:\n  options: [a, b]\n"));
    assertThrows(ConfigValidationException.class, () -> loader.loadResource("no-such-session.yaml"));
  }
}
