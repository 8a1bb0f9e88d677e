package io.genfactory;

import io.genfactory.registry.FactoryCatalog;

import java.util.Objects;

/**
 * Binds one factory to one key as a side effect of being constructed.
 *
 * <p>A registrar is typically a {@code static final} field of the implementation class,
 * so the binding happens when that class is initialized:
 *
 * <pre>{@code
 * public final class Circle implements Shape {
 *   static final Registrar<Shape, Void> REGISTRAR =
 *       new Registrar<>(Shapes.FAMILY, "circle", FactoryFunction.nullary(Circle::new));
 *   ...
 * }
 * }</pre>
 *
 * <p>The JVM initializes classes lazily, so a registrar field only runs once something
 * touches its class. Applications that cannot guarantee that should register through a
 * {@link io.genfactory.spi.FactoryProvider} instead.
 *
 * <p>Registration cannot fail unless the catalog's duplicate policy is
 * {@link io.genfactory.registry.DuplicatePolicy#FAIL}.
 *
 * @param <T> the abstract type produced
 * @param <A> the construction argument type
 */
public final class Registrar<T, A> {
  private final FactoryFamily<T, A> family;
  private final String key;

  /**
   * Registers the factory in the {@link FactoryCatalog#global() global catalog}.
   *
   * @param family the family
   * @param key the key
   * @param factory the factory
   */
  public Registrar(FactoryFamily<T, A> family, String key,
      FactoryFunction<? extends T, ? super A> factory) {
    this(FactoryCatalog.global(), family, key, factory);
  }

  /**
   * Registers the factory in the given catalog.
   *
   * @param catalog the catalog
   * @param family the family
   * @param key the key
   * @param factory the factory
   */
  public Registrar(FactoryCatalog catalog, FactoryFamily<T, A> family, String key,
      FactoryFunction<? extends T, ? super A> factory) {
    this.family = Objects.requireNonNull(family, "family");
    this.key = Objects.requireNonNull(key, "key");
    Objects.requireNonNull(catalog, "catalog").register(family, key, factory);
  }

  public FactoryFamily<T, A> family() {
    return family;
  }

  public String key() {
    return key;
  }

  @Override
  public String toString() {
    return "Registrar[" + family.name() + ", key=" + key + "]";
  }
}
