package io.genfactory.registry;

import io.genfactory.FactoryFamily;
import io.genfactory.FactoryFunction;
import io.genfactory.handle.Handle;

import java.util.Optional;
import java.util.Set;

/**
 * Mapping from string key to factory for one {@link FactoryFamily}.
 *
 * <p>A key, once inserted, maps to the same factory for the lifetime of the registry.
 * Later insertions for that key never replace it; see {@link DuplicatePolicy} for what
 * happens instead.
 *
 * @param <T> the abstract type produced
 * @param <A> the construction argument type
 * @see DefaultFactoryRegistry
 * @see FactoryCatalog#registry(FactoryFamily)
 */
public interface FactoryRegistry<T, A> {

  /**
   * Returns the family this registry serves.
   *
   * @return the family
   */
  FactoryFamily<T, A> family();

  /**
   * Inserts a factory for the key if the key is not yet registered.
   *
   * <p>No value reports whether the insertion took place; use {@link #contains(String)}
   * beforehand when that matters.
   *
   * @param key the key
   * @param factory the factory
   * @throws DuplicateRegistrationException if the key is taken and the policy is
   *     {@link DuplicatePolicy#FAIL}
   */
  void insert(String key, FactoryFunction<? extends T, ? super A> factory);

  /**
   * Constructs a new instance through the factory registered for the key.
   *
   * <p>An unknown key is a normal outcome and yields an empty result. Exceptions thrown
   * by the factory itself propagate unchanged.
   *
   * @param key the key
   * @param arguments the construction arguments, passed to the factory as-is
   * @return a handle of the family's ownership kind, or empty if the key is unknown
   * @throws NullPointerException if the key is null, or the factory returns null
   */
  Optional<Handle<T>> construct(String key, A arguments);

  /**
   * Constructs with null arguments, the form used by {@link Void} families.
   *
   * @param key the key
   * @return a handle of the family's ownership kind, or empty if the key is unknown
   * @throws NullPointerException if the key is null
   */
  default Optional<Handle<T>> construct(String key) {
    return construct(key, null);
  }

  /**
   * Returns whether a factory is registered for the key.
   *
   * @param key the key
   * @return true if registered
   */
  boolean contains(String key);

  /**
   * Returns the registered keys.
   *
   * @return sorted, unmodifiable snapshot of the keys
   */
  Set<String> keys();
}
