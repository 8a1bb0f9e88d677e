package io.genfactory.handle;

import java.util.Objects;

/**
 * How a constructed instance is owned by the caller that receives it.
 *
 * <p>Each abstract type resolves to exactly one policy via {@link #resolve(Class)}:
 * the value of its {@link PreferredOwnership} annotation, or {@link #SHARED} when
 * the type declares none.
 *
 * @see Handle
 * @see PreferredOwnership
 */
public enum OwnershipPolicy {

  /**
   * Sole ownership. The handle can be transferred but never copied.
   */
  EXCLUSIVE {
    @Override
    public <T> Handle<T> wrap(T instance) {
      return new ExclusiveHandle<>(instance);
    }
  },

  /**
   * Reference-counted ownership. The instance lives as long as its last holder.
   */
  SHARED {
    @Override
    public <T> Handle<T> wrap(T instance) {
      return new SharedHandle<>(instance);
    }
  },

  /**
   * No ownership. Lifetime management is entirely the caller's problem.
   */
  BORROWED {
    @Override
    public <T> Handle<T> wrap(T instance) {
      return new BorrowedHandle<>(instance);
    }
  };

  /**
   * The policy used for abstract types without a {@link PreferredOwnership} declaration.
   */
  public static final OwnershipPolicy DEFAULT = SHARED;

  /**
   * Wraps a freshly constructed instance in the handle kind of this policy.
   *
   * @param instance the instance, never null
   * @param <T> the instance type
   * @return a new open handle
   */
  public abstract <T> Handle<T> wrap(T instance);

  /**
   * Resolves the preferred ownership of an abstract type.
   *
   * @param abstractType the abstract type
   * @return the declared policy, or {@link #DEFAULT}
   */
  public static OwnershipPolicy resolve(Class<?> abstractType) {
    Objects.requireNonNull(abstractType, "abstractType");
    PreferredOwnership preferred = abstractType.getAnnotation(PreferredOwnership.class);
    return preferred != null ? preferred.value() : DEFAULT;
  }
}
