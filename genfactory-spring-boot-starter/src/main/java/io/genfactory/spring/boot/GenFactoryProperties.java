package io.genfactory.spring.boot;

import io.genfactory.registry.DuplicatePolicy;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the factory catalog.
 *
 * @see GenFactoryAutoConfiguration
 */
@ConfigurationProperties(prefix = "genfactory")
public class GenFactoryProperties {

    /**
     * Handling of a registration whose key is already taken: ignore, warn, or fail.
     */
    private DuplicatePolicy duplicatePolicy = DuplicatePolicy.IGNORE;

    /**
     * Expose the process-wide global catalog as the bean instead of building one.
     * The global catalog takes its duplicate policy from the
     * {@code genfactory.duplicate-policy} system property and records no metrics.
     */
    private boolean useGlobalCatalog = false;

    private final Discovery serviceLoader = new Discovery();
    private final Metrics metrics = new Metrics();

    public DuplicatePolicy getDuplicatePolicy() {
        return duplicatePolicy;
    }

    public void setDuplicatePolicy(DuplicatePolicy duplicatePolicy) {
        this.duplicatePolicy = duplicatePolicy;
    }

    public boolean isUseGlobalCatalog() {
        return useGlobalCatalog;
    }

    public void setUseGlobalCatalog(boolean useGlobalCatalog) {
        this.useGlobalCatalog = useGlobalCatalog;
    }

    public Discovery getServiceLoader() {
        return serviceLoader;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Discovery {
        /**
         * Install {@code META-INF/services} factory providers into the catalog at startup.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "genfactory";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
