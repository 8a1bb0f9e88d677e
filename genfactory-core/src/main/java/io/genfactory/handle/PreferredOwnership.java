package io.genfactory.handle;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the handle kind that factories for the annotated abstract type produce.
 *
 * <p>Only the abstract type itself is inspected; the annotation is not inherited
 * by sub-interfaces or implementations.
 *
 * <pre>{@code
 * @PreferredOwnership(OwnershipPolicy.EXCLUSIVE)
 * public interface Connection extends AutoCloseable { ... }
 * }</pre>
 *
 * @see OwnershipPolicy#resolve(Class)
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface PreferredOwnership {

  /**
   * The preferred handle kind.
   */
  OwnershipPolicy value();
}
