package io.intellixity.plantframe.methods;

import io.intellixity.plantframe.analysis.method.MethodContributor;
import io.intellixity.plantframe.analysis.method.MethodRegistry;

/** Registers the built-in plant analysis methods; discovered through {@code META-INF/plantframe.factories}. */
public final class PlantMethods implements MethodContributor {
  @Override
  public void contribute(MethodRegistry registry) {
    registerAll(registry);
  }

  public static MethodRegistry registerAll(MethodRegistry registry) {
    return registry
        .register(PlantEnergySummary.definition())
        .register(WindClimatology.definition());
  }
}
