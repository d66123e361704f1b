package io.intellixity.plantframe.methods;

import io.intellixity.plantframe.analysis.method.InMemoryMethodRegistry;
import io.intellixity.plantframe.analysis.method.MethodDefinition;
import io.intellixity.plantframe.analysis.method.MethodId;
import io.intellixity.plantframe.error.DuplicateNameException;
import io.intellixity.plantframe.toolkit.ToolkitCatalog;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PlantMethodsTest {
  @Test
  void builtinMethodsAreDiscovered() {
    InMemoryMethodRegistry reg = InMemoryMethodRegistry.discover();
    assertTrue(reg.contains(new MethodId(PlantEnergySummary.NAME, PlantEnergySummary.VERSION)));
    assertTrue(reg.contains(new MethodId(WindClimatology.NAME, WindClimatology.VERSION)));
    assertEquals(2, reg.all().size());
    assertThrows(DuplicateNameException.class, () -> PlantMethods.registerAll(reg));
  }

  @Test
  void declaredToolkitsExistInTheBuiltinCatalog() {
    ToolkitCatalog catalog = ToolkitCatalog.discover();
    for (MethodDefinition m : InMemoryMethodRegistry.discover().all()) {
      m.toolkits().forEach(t -> assertTrue(catalog.contains(t), m.id() + " needs " + t));
    }
  }
}
