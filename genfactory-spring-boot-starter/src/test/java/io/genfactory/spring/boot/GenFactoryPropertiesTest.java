package io.genfactory.spring.boot;

import io.genfactory.registry.DuplicatePolicy;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenFactoryPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(GenFactoryProperties.class);
            assertEquals(DuplicatePolicy.IGNORE, props.getDuplicatePolicy());
            assertFalse(props.isUseGlobalCatalog());
            assertTrue(props.getServiceLoader().isEnabled());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("genfactory", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "genfactory.duplicate-policy=warn",
                "genfactory.use-global-catalog=true",
                "genfactory.service-loader.enabled=false",
                "genfactory.metrics.enabled=false",
                "genfactory.metrics.name-prefix=plugins.factory"
        ).run(ctx -> {
            var props = ctx.getBean(GenFactoryProperties.class);
            assertEquals(DuplicatePolicy.WARN, props.getDuplicatePolicy());
            assertTrue(props.isUseGlobalCatalog());
            assertFalse(props.getServiceLoader().isEnabled());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("plugins.factory", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(GenFactoryProperties.class)
    static class PropsConfig {
    }
}
