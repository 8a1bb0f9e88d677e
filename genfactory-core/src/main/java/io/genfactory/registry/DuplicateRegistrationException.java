package io.genfactory.registry;

import io.genfactory.FactoryFamily;

/**
 * Thrown under {@link DuplicatePolicy#FAIL} when a key is registered twice in one family.
 */
public final class DuplicateRegistrationException extends RuntimeException {
  private final FactoryFamily<?, ?> family;
  private final String key;

  public DuplicateRegistrationException(FactoryFamily<?, ?> family, String key) {
    super("Key '" + key + "' is already registered in " + family.name());
    this.family = family;
    this.key = key;
  }

  public FactoryFamily<?, ?> family() {
    return family;
  }

  public String key() {
    return key;
  }
}
