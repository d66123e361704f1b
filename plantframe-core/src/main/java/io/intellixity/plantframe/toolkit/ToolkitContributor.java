package io.intellixity.plantframe.toolkit;

/**
 * SPI: contributes toolkits to a catalog. Implementations are listed in {@code META-INF/plantframe.factories}.
 */
public interface ToolkitContributor {
  void contribute(ToolkitCatalog catalog);
}
