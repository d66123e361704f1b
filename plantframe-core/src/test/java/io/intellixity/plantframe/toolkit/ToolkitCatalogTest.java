package io.intellixity.plantframe.toolkit;

import io.intellixity.plantframe.error.DuplicateNameException;
import io.intellixity.plantframe.error.NotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ToolkitCatalogTest {
  private static Toolkit identity(String name, String version) {
    return PipelineToolkit.builder(name, version).step("identity", (h, p) -> h).build();
  }

  @Test
  void registrationIsFirstWinsPerNameAndVersion() {
    ToolkitCatalog c = new ToolkitCatalog().register(identity("meter-energy", "1.0"));
    assertThrows(DuplicateNameException.class, () -> c.register(identity("meter-energy", "1.0")));
    c.register(identity("meter-energy", "1.10")).register(identity("meter-energy", "1.9"));

    assertEquals("1.10", c.latest("meter-energy").id().version());
    assertEquals(List.of("1.0", "1.9", "1.10"), c.all().stream().map(t -> t.id().version()).toList());
    assertThrows(NotFoundException.class, () -> c.lookup("meter-energy", "2.0"));
    assertThrows(NotFoundException.class, () -> c.latest("gross-energy"));
  }

  @Test
  void paramsMergeAndCoerce() {
    ToolkitParams defaults = ToolkitParams.of("frequency", "MS", "interval_minutes", 10);
    ToolkitParams p = defaults.merge(ToolkitParams.of("frequency", "D").with("rho_ref", "1.2"));

    assertEquals("D", p.getString("frequency", "MS"));
    assertEquals(10, p.getInt("interval_minutes", 0));
    assertEquals(1.2, p.requireDouble("rho_ref"));
    assertFalse(p.getBoolean("strict", false));
    assertThrows(IllegalArgumentException.class, () -> p.requireDouble("capacity"));
    assertThrows(IllegalArgumentException.class, () -> p.with("n", "ten").getInt("n", 0));
    // defaults are left untouched
    assertEquals("MS", defaults.requireString("frequency"));
  }
}
