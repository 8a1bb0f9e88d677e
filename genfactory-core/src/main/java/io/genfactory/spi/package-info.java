/**
 * Service Provider Interfaces (SPI) for extending the factory registry.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to contribute factories and to export registry metrics.
 *
 * @see io.genfactory.spi.FactoryProvider
 * @see io.genfactory.spi.MetricsExporter
 */
package io.genfactory.spi;
