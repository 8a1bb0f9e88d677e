package io.genfactory.spring.boot;

import io.genfactory.micrometer.MicrometerMetricsExporter;
import io.genfactory.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Publishes registry activity to Micrometer.
 *
 * <p>Every registry created by the {@link io.genfactory.registry.FactoryCatalog} bean reports
 * registrations, duplicate keys, constructions, unknown-key lookups and factory failures
 * through the {@link MetricsExporter} defined here. The counters are named under
 * {@code genfactory.metrics.name-prefix} and tagged by family.
 *
 * <p>Ordered ahead of {@link GenFactoryAutoConfiguration}, which hands the exporter to the
 * catalog it builds. Turned off with {@code genfactory.metrics.enabled=false}, and replaced
 * by any user-defined {@link MetricsExporter} bean.
 */
@AutoConfiguration(before = GenFactoryAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "genfactory.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(GenFactoryProperties.class)
public class GenFactoryMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, GenFactoryProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
