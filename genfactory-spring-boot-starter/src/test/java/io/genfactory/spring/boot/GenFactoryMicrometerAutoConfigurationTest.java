package io.genfactory.spring.boot;

import io.genfactory.micrometer.MicrometerMetricsExporter;
import io.genfactory.registry.FactoryCatalog;
import io.genfactory.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenFactoryMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(GenFactoryMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void catalogRecordsIntoMeterRegistry() {
        runner.withConfiguration(AutoConfigurations.of(GenFactoryAutoConfiguration.class)).run(ctx -> {
            var catalog = ctx.getBean(FactoryCatalog.class);
            assertSame(ctx.getBean(MetricsExporter.class), catalog.metrics());

            catalog.construct(PaletteProvider.COLORS, "red", null);

            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("genfactory.registrations").counter());
            var constructed = registry.find("genfactory.construct.success")
                    .tag("family", PaletteProvider.COLORS.name())
                    .counter();
            assertNotNull(constructed);
            assertEquals(1.0, constructed.count());
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withConfiguration(AutoConfigurations.of(GenFactoryAutoConfiguration.class))
                .withPropertyValues("genfactory.metrics.name-prefix=my.factory")
                .run(ctx -> {
                    var registry = ctx.getBean(MeterRegistry.class);
                    // Service-loaded providers register at startup
                    assertNotNull(registry.find("my.factory.registrations").counter());
                });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("genfactory.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
