package io.genfactory.spring.boot;

import io.genfactory.handle.OwnershipPolicy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a factory to be inserted into the {@link io.genfactory.registry.FactoryCatalog}.
 *
 * <p>The annotated bean must implement {@link io.genfactory.FactoryFunction}. The annotation
 * names the family (abstract type plus argument type) and the key the factory is registered under.
 *
 * <pre>{@code
 * @Component
 * @RegisteredFactory(family = Shape.class, key = "circle")
 * public class CircleFactory implements FactoryFunction<Shape, Void> {
 *   public Shape create(Void ignored) { return new Circle(); }
 * }
 * }</pre>
 *
 * <p>Resolution rules:
 * <ul>
 *   <li>{@code key} must not be blank</li>
 *   <li>{@code arguments} defaults to {@code Void}, a family constructed without arguments</li>
 *   <li>{@code ownership} overrides the policy resolved from the family type; at most one value</li>
 * </ul>
 *
 * @see RegisteredFactoryRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RegisteredFactory {

    /**
     * Key the factory is registered under.
     */
    String key();

    /**
     * Abstract type of the family.
     */
    Class<?> family();

    /**
     * Argument type of the family. Defaults to no arguments.
     */
    Class<?> arguments() default Void.class;

    /**
     * Ownership override. Empty resolves the policy from {@link #family()}.
     */
    OwnershipPolicy[] ownership() default {};
}
