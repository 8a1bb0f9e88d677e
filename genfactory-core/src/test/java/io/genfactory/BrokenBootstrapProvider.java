package io.genfactory;

import io.genfactory.registry.FactoryCatalog;
import io.genfactory.spi.FactoryProvider;

public class BrokenBootstrapProvider implements FactoryProvider {

  @Override
  public void registerFactories(FactoryCatalog catalog) {
    throw new IllegalStateException("broken provider");
  }

  @Override
  public int order() {
    return 100;
  }
}
