/**
 * Spring Boot auto-configuration for the factory catalog.
 *
 * <p>{@link io.genfactory.spring.boot.GenFactoryAutoConfiguration} exposes a
 * {@link io.genfactory.registry.FactoryCatalog} configured from {@code genfactory.*}
 * application properties.
 *
 * <p>Use {@link io.genfactory.spring.boot.RegisteredFactory @RegisteredFactory} on beans
 * implementing {@link io.genfactory.FactoryFunction} to register factories declaratively.
 *
 * @see io.genfactory.spring.boot.GenFactoryAutoConfiguration
 * @see io.genfactory.spring.boot.GenFactoryProperties
 * @see io.genfactory.spring.boot.RegisteredFactory
 * @see io.genfactory.spring.boot.RegisteredFactoryRegistrar
 */
package io.genfactory.spring.boot;
