package io.genfactory.spi;

/**
 * Observability hook for exporting registry counters to a metrics backend.
 *
 * <p>Every method receives the {@link io.genfactory.FactoryFamily#name() family name}.
 * Keys are not passed: requested keys may come from user input and would make
 * tag cardinality unbounded.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of factories inserted into a registry.
     */
    void incrementRegistered(String family);

    /**
     * Increments the count of registrations rejected because the key was already taken.
     */
    void incrementDuplicate(String family);

    /**
     * Increments the count of instances constructed successfully.
     */
    void incrementConstructed(String family);

    /**
     * Increments the count of construct calls for keys with no registered factory.
     */
    void incrementNotFound(String family);

    /**
     * Increments the count of construct calls whose factory threw.
     */
    default void incrementConstructionFailure(String family) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementRegistered(String family) {
        }

        @Override
        public void incrementDuplicate(String family) {
        }

        @Override
        public void incrementConstructed(String family) {
        }

        @Override
        public void incrementNotFound(String family) {
        }
    }
}
