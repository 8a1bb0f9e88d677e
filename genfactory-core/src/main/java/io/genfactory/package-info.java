/**
 * Runtime selection among a family of implementations identified by a string key.
 *
 * <p>Implementations bind themselves to keys with a {@link io.genfactory.Registrar} or a
 * {@link io.genfactory.spi.FactoryProvider}; callers construct them by key through
 * {@link io.genfactory.Factories} or a {@link io.genfactory.registry.FactoryCatalog}.
 *
 * @see io.genfactory.FactoryFamily
 * @see io.genfactory.registry.FactoryRegistry
 * @see io.genfactory.handle.Handle
 */
package io.genfactory;
