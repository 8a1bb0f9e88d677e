package io.genfactory.registry;

import io.genfactory.FactoryFamily;
import io.genfactory.FactoryFunction;
import io.genfactory.handle.Handle;
import io.genfactory.spi.FactoryProvider;
import io.genfactory.spi.MetricsExporter;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds one {@link FactoryRegistry} per {@link FactoryFamily}, each created empty on
 * first access.
 *
 * <p>{@link #global()} is the process-wide catalog. It is created on first use,
 * does not depend on any other static initializer, and lives until the JVM exits.
 * Isolated catalogs (for tests, or one per application context) come from
 * {@link #builder()}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * FactoryCatalog catalog = FactoryCatalog.builder()
 *     .duplicatePolicy(DuplicatePolicy.WARN)
 *     .metrics(exporter)
 *     .build();
 *
 * catalog.register(FactoryFamily.of(Shape.class), "circle", FactoryFunction.nullary(Circle::new));
 * Optional<Handle<Shape>> circle = catalog.construct(FactoryFamily.of(Shape.class), "circle", null);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Registry creation, registration and lookup are all safe to call concurrently.
 */
public final class FactoryCatalog {
  private static final Logger logger = Logger.getLogger(FactoryCatalog.class.getName());

  private final DuplicatePolicy duplicatePolicy;
  private final MetricsExporter metrics;
  private final Map<FactoryFamily<?, ?>, FactoryRegistry<?, ?>> registries = new ConcurrentHashMap<>();
  private final Set<String> installedProviders = ConcurrentHashMap.newKeySet();

  private FactoryCatalog(Builder builder) {
    this.duplicatePolicy = builder.duplicatePolicy;
    this.metrics = builder.metrics;
  }

  /**
   * Returns the process-wide catalog, creating it on first call with the duplicate policy
   * read from {@value DuplicatePolicy#SYSTEM_PROPERTY}.
   *
   * @return the global catalog
   */
  public static FactoryCatalog global() {
    return GlobalHolder.INSTANCE;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the registry for the family, creating it empty on first call.
   *
   * @param family the family
   * @param <T> the abstract type produced
   * @param <A> the construction argument type
   * @return the family's registry
   */
  @SuppressWarnings("unchecked")
  public <T, A> FactoryRegistry<T, A> registry(FactoryFamily<T, A> family) {
    Objects.requireNonNull(family, "family");
    return (FactoryRegistry<T, A>) registries.computeIfAbsent(family, ignored -> {
      logger.log(Level.FINE, "Creating registry for {0}", family.name());
      return new DefaultFactoryRegistry<>(family, duplicatePolicy, metrics);
    });
  }

  /**
   * Inserts a factory into the family's registry.
   *
   * @see FactoryRegistry#insert(String, FactoryFunction)
   */
  public <T, A> void register(FactoryFamily<T, A> family, String key,
      FactoryFunction<? extends T, ? super A> factory) {
    registry(family).insert(key, factory);
  }

  /**
   * Constructs an instance through the family's registry.
   *
   * @see FactoryRegistry#construct(String, Object)
   */
  public <T, A> Optional<Handle<T>> construct(FactoryFamily<T, A> family, String key, A arguments) {
    return registry(family).construct(key, arguments);
  }

  /**
   * Runs a provider's registrations unless a provider of the same class already ran
   * against this catalog. A provider that throws is not marked installed and runs again
   * on the next call.
   *
   * @param provider the provider
   * @return true if the provider ran, false if it was skipped
   */
  public boolean install(FactoryProvider provider) {
    Objects.requireNonNull(provider, "provider");
    String name = provider.getClass().getName();
    if (!installedProviders.add(name)) {
      logger.log(Level.FINE, "Provider {0} already installed", name);
      return false;
    }
    try {
      provider.registerFactories(this);
    } catch (RuntimeException | Error e) {
      // Registrations made before the failure stay; a retry re-runs the provider
      installedProviders.remove(name);
      throw e;
    }
    logger.log(Level.FINE, "Installed provider {0}", name);
    return true;
  }

  /**
   * Returns the families whose registries exist.
   *
   * @return unmodifiable snapshot of the families
   */
  public Set<FactoryFamily<?, ?>> families() {
    return Set.copyOf(registries.keySet());
  }

  public DuplicatePolicy duplicatePolicy() {
    return duplicatePolicy;
  }

  public MetricsExporter metrics() {
    return metrics;
  }

  private static final class GlobalHolder {
    private static final FactoryCatalog INSTANCE = builder()
        .duplicatePolicy(DuplicatePolicy.fromSystemProperty())
        .build();
  }

  public static final class Builder {
    private DuplicatePolicy duplicatePolicy = DuplicatePolicy.IGNORE;
    private MetricsExporter metrics = MetricsExporter.NOOP;

    private Builder() {}

    /**
     * Sets what registries do with duplicate keys. Default: {@link DuplicatePolicy#IGNORE}.
     */
    public Builder duplicatePolicy(DuplicatePolicy duplicatePolicy) {
      this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
      return this;
    }

    /**
     * Sets the metrics exporter. Default: {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public FactoryCatalog build() {
      return new FactoryCatalog(this);
    }
  }
}
