package io.genfactory.registry;

import java.util.Arrays;
import java.util.Locale;

/**
 * What a registry does when a factory is inserted under a key that is already taken.
 *
 * <p>In every case the first registration stays in place.
 */
public enum DuplicatePolicy {

  /** Drop the later registration silently. */
  IGNORE,

  /** Drop the later registration and log a warning. */
  WARN,

  /** Reject the later registration with a {@link DuplicateRegistrationException}. */
  FAIL;

  /**
   * System property read by {@link FactoryCatalog#global()}.
   */
  public static final String SYSTEM_PROPERTY = "genfactory.duplicate-policy";

  /**
   * Parses a policy name, case-insensitively.
   *
   * @param value one of {@code ignore}, {@code warn}, {@code fail}
   * @return the policy
   * @throws IllegalArgumentException if the value names no policy
   */
  public static DuplicatePolicy parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Duplicate policy cannot be null or empty");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown duplicate policy: " + value
          + ". Available: " + Arrays.toString(values()), e);
    }
  }

  /**
   * Reads {@value #SYSTEM_PROPERTY}, defaulting to {@link #IGNORE}.
   *
   * @return the configured policy
   */
  public static DuplicatePolicy fromSystemProperty() {
    String value = System.getProperty(SYSTEM_PROPERTY);
    return value == null ? IGNORE : parse(value);
  }
}
