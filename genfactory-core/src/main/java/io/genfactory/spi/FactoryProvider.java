package io.genfactory.spi;

import io.genfactory.registry.FactoryCatalog;

/**
 * Contributes factory registrations during an explicit registration phase.
 *
 * <p>Implementation modules list their providers in
 * {@code META-INF/services/io.genfactory.spi.FactoryProvider}; the host application
 * decides when they run through {@link io.genfactory.bootstrap.FactoryProviders}.
 *
 * <pre>{@code
 * public final class ShapeFactories implements FactoryProvider {
 *   @Override
 *   public void registerFactories(FactoryCatalog catalog) {
 *     FactoryRegistry<Shape, Void> shapes = catalog.registry(FactoryFamily.of(Shape.class));
 *     shapes.insert("circle", FactoryFunction.nullary(Circle::new));
 *     shapes.insert("square", FactoryFunction.nullary(Square::new));
 *   }
 * }
 * }</pre>
 *
 * <p>Providers must have a public no-arg constructor.
 */
public interface FactoryProvider {

  /**
   * Inserts this provider's factories into the catalog.
   *
   * @param catalog the catalog being populated
   */
  void registerFactories(FactoryCatalog catalog);

  /**
   * Position of this provider in the registration phase. Lower values run first, so
   * they win when two providers register the same key. Ties are broken by class name.
   *
   * @return the order, 0 by default
   */
  default int order() {
    return 0;
  }
}
