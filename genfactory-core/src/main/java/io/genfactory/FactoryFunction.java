package io.genfactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Builds a new instance of a concrete implementation from the family's construction
 * arguments.
 *
 * <p>Factories must not depend on registration order and must not return null.
 * Unchecked exceptions thrown here reach the caller of
 * {@link io.genfactory.registry.FactoryRegistry#construct} unchanged.
 *
 * @param <T> the abstract type produced
 * @param <A> the construction argument type ({@link Void} for argument-less families)
 */
@FunctionalInterface
public interface FactoryFunction<T, A> {

  /**
   * Creates a new instance.
   *
   * @param arguments the construction arguments, null for {@link Void} families
   * @return the new instance
   */
  T create(A arguments);

  /**
   * Adapts a supplier to a factory that ignores its arguments.
   *
   * <pre>{@code
   * registry.insert("circle", FactoryFunction.nullary(Circle::new));
   * }</pre>
   *
   * @param supplier the instance supplier
   * @param <T> the abstract type produced
   * @param <A> the (ignored) argument type
   * @return a factory delegating to the supplier
   */
  static <T, A> FactoryFunction<T, A> nullary(Supplier<? extends T> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    return arguments -> supplier.get();
  }
}
