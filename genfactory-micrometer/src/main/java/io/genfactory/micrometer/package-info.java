/**
 * Micrometer integration for registry metrics.
 *
 * <p>Provides {@link io.genfactory.micrometer.MicrometerMetricsExporter}, which bridges
 * {@link io.genfactory.spi.MetricsExporter} to a Micrometer
 * {@link io.micrometer.core.instrument.MeterRegistry}.
 */
package io.genfactory.micrometer;
