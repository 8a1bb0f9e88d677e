/**
 * Factory routing by string key, one registry per {@link io.genfactory.FactoryFamily}.
 *
 * <p>Each key maps to a single factory; the first registration wins. Unknown keys
 * construct to an empty result rather than an error.
 *
 * @see io.genfactory.registry.FactoryRegistry
 * @see io.genfactory.registry.FactoryCatalog
 */
package io.genfactory.registry;
