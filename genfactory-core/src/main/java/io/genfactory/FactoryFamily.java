package io.genfactory;

import io.genfactory.handle.OwnershipPolicy;

import java.util.Objects;

/**
 * Identity of one factory registry: the abstract type produced, the construction
 * argument type, and the ownership policy of the returned handles.
 *
 * <p>Equal families share a registry. Families that differ in any component have
 * independent key namespaces, so {@code "base"} may name an {@code Animal} in one
 * family and a {@code Vehicle} in another.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Argument-less family, ownership resolved from Shape's @PreferredOwnership (or SHARED)
 * FactoryFamily<Shape, Void> shapes = FactoryFamily.of(Shape.class);
 *
 * // Family whose factories take a ModelConfig
 * FactoryFamily<Model, ModelConfig> models = FactoryFamily.of(Model.class, ModelConfig.class);
 *
 * // Explicit per-family policy
 * FactoryFamily<Model, ModelConfig> owned = models.withOwnership(OwnershipPolicy.EXCLUSIVE);
 * }</pre>
 *
 * @param <T> the abstract type produced
 * @param <A> the construction argument type
 */
public final class FactoryFamily<T, A> {
  private final Class<T> abstractType;
  private final Class<A> argumentType;
  private final OwnershipPolicy ownership;

  private FactoryFamily(Class<T> abstractType, Class<A> argumentType, OwnershipPolicy ownership) {
    this.abstractType = Objects.requireNonNull(abstractType, "abstractType");
    this.argumentType = Objects.requireNonNull(argumentType, "argumentType");
    this.ownership = Objects.requireNonNull(ownership, "ownership");
  }

  /**
   * Creates an argument-less family with the ownership policy resolved from the abstract type.
   *
   * @param abstractType the abstract type produced
   * @param <T> the abstract type
   * @return the family
   */
  public static <T> FactoryFamily<T, Void> of(Class<T> abstractType) {
    return of(abstractType, Void.class);
  }

  /**
   * Creates a family with the ownership policy resolved from the abstract type.
   *
   * @param abstractType the abstract type produced
   * @param argumentType the construction argument type
   * @param <T> the abstract type
   * @param <A> the argument type
   * @return the family
   */
  public static <T, A> FactoryFamily<T, A> of(Class<T> abstractType, Class<A> argumentType) {
    return new FactoryFamily<>(abstractType, argumentType, OwnershipPolicy.resolve(abstractType));
  }

  /**
   * Returns the same family with an explicit ownership policy.
   *
   * @param ownership the policy to use instead of the resolved one
   * @return a family differing only in ownership
   */
  public FactoryFamily<T, A> withOwnership(OwnershipPolicy ownership) {
    return new FactoryFamily<>(abstractType, argumentType, ownership);
  }

  public Class<T> abstractType() {
    return abstractType;
  }

  public Class<A> argumentType() {
    return argumentType;
  }

  public OwnershipPolicy ownership() {
    return ownership;
  }

  /**
   * Short display name, also used as the metrics tag, e.g. {@code Shape(Void)/SHARED}.
   *
   * @return the family name
   */
  public String name() {
    return abstractType.getSimpleName() + "(" + argumentType.getSimpleName() + ")/" + ownership;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FactoryFamily<?, ?> other)) {
      return false;
    }
    return abstractType.equals(other.abstractType)
        && argumentType.equals(other.argumentType)
        && ownership == other.ownership;
  }

  @Override
  public int hashCode() {
    return Objects.hash(abstractType, argumentType, ownership);
  }

  @Override
  public String toString() {
    return "FactoryFamily[" + abstractType.getName() + "(" + argumentType.getName() + ")/"
        + ownership + "]";
  }
}
