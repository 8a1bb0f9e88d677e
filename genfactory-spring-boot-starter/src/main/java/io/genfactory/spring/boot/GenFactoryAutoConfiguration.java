package io.genfactory.spring.boot;

import io.genfactory.bootstrap.FactoryProviders;
import io.genfactory.registry.FactoryCatalog;
import io.genfactory.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.ClassUtils;

/**
 * Auto-configuration for the factory catalog.
 *
 * <p>Exposes a {@link FactoryCatalog} built from {@link GenFactoryProperties}, installs
 * {@code META-INF/services} providers into it, and registers
 * {@link RegisteredFactory @RegisteredFactory} beans once all singletons exist.
 *
 * @see GenFactoryProperties
 * @see GenFactoryMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(FactoryCatalog.class)
@EnableConfigurationProperties(GenFactoryProperties.class)
public class GenFactoryAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public FactoryCatalog factoryCatalog(GenFactoryProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    FactoryCatalog catalog;
    if (props.isUseGlobalCatalog()) {
      catalog = FactoryCatalog.global();
    } else {
      var builder = FactoryCatalog.builder().duplicatePolicy(props.getDuplicatePolicy());
      MetricsExporter metrics = metricsProvider.getIfAvailable();
      if (metrics != null) {
        builder.metrics(metrics);
      }
      catalog = builder.build();
    }
    if (props.getServiceLoader().isEnabled()) {
      FactoryProviders.installAll(catalog, ClassUtils.getDefaultClassLoader());
    }
    return catalog;
  }

  @Bean
  @ConditionalOnMissingBean
  public RegisteredFactoryRegistrar registeredFactoryRegistrar(
      ListableBeanFactory beanFactory, FactoryCatalog factoryCatalog) {
    return new RegisteredFactoryRegistrar(beanFactory, factoryCatalog);
  }
}
