/**
 * Explicit registration phase: {@link java.util.ServiceLoader} discovery of
 * {@link io.genfactory.spi.FactoryProvider} implementations.
 */
package io.genfactory.bootstrap;
