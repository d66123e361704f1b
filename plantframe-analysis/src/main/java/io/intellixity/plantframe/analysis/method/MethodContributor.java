package io.intellixity.plantframe.analysis.method;

/** SPI: contributes methods to a registry. Implementations are listed in {@code META-INF/plantframe.factories}. */
public interface MethodContributor {
  void contribute(MethodRegistry registry);
}
