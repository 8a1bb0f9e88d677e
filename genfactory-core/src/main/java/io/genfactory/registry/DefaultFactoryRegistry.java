package io.genfactory.registry;

import io.genfactory.FactoryFamily;
import io.genfactory.FactoryFunction;
import io.genfactory.handle.Handle;
import io.genfactory.spi.MetricsExporter;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe {@link FactoryRegistry}.
 *
 * <p>Insertion is first-wins and atomic: of two concurrent registrations for one key,
 * exactly one is kept. Lookups never block registrations.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * FactoryRegistry<Shape, Void> shapes = new DefaultFactoryRegistry<>(FactoryFamily.of(Shape.class));
 * shapes.insert("circle", FactoryFunction.nullary(Circle::new));
 *
 * Optional<Handle<Shape>> circle = shapes.construct("circle");    // present
 * Optional<Handle<Shape>> none = shapes.construct("triangle");    // empty
 * }</pre>
 *
 * @param <T> the abstract type produced
 * @param <A> the construction argument type
 */
public final class DefaultFactoryRegistry<T, A> implements FactoryRegistry<T, A> {
  private static final Logger logger = Logger.getLogger(DefaultFactoryRegistry.class.getName());

  private final FactoryFamily<T, A> family;
  private final DuplicatePolicy duplicatePolicy;
  private final MetricsExporter metrics;
  private final Map<String, FactoryFunction<? extends T, ? super A>> factories = new ConcurrentHashMap<>();

  /**
   * Creates a registry that ignores duplicates and exports no metrics.
   *
   * @param family the family served
   */
  public DefaultFactoryRegistry(FactoryFamily<T, A> family) {
    this(family, DuplicatePolicy.IGNORE, MetricsExporter.NOOP);
  }

  public DefaultFactoryRegistry(FactoryFamily<T, A> family, DuplicatePolicy duplicatePolicy,
      MetricsExporter metrics) {
    this.family = Objects.requireNonNull(family, "family");
    this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public FactoryFamily<T, A> family() {
    return family;
  }

  @Override
  public void insert(String key, FactoryFunction<? extends T, ? super A> factory) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(factory, "factory");

    FactoryFunction<? extends T, ? super A> existing = factories.putIfAbsent(key, factory);
    if (existing == null) {
      metrics.incrementRegistered(family.name());
      logger.log(Level.FINE, "Registered factory ''{0}'' in {1}", new Object[]{key, family.name()});
      return;
    }

    metrics.incrementDuplicate(family.name());
    switch (duplicatePolicy) {
      case IGNORE -> {
      }
      case WARN -> logger.log(Level.WARNING,
          "Ignoring duplicate registration of ''{0}'' in {1}; the first registration is kept",
          new Object[]{key, family.name()});
      case FAIL -> throw new DuplicateRegistrationException(family, key);
    }
  }

  @Override
  public Optional<Handle<T>> construct(String key, A arguments) {
    Objects.requireNonNull(key, "key");

    FactoryFunction<? extends T, ? super A> factory = factories.get(key);
    if (factory == null) {
      metrics.incrementNotFound(family.name());
      return Optional.empty();
    }

    T instance = null;
    try {
      instance = factory.create(arguments);
    } finally {
      // Covers thrown errors and a null result alike
      if (instance == null) {
        metrics.incrementConstructionFailure(family.name());
      }
    }
    if (instance == null) {
      throw new NullPointerException(
          "Factory '" + key + "' in " + family.name() + " returned null");
    }

    metrics.incrementConstructed(family.name());
    return Optional.of(family.ownership().wrap(family.abstractType().cast(instance)));
  }

  @Override
  public boolean contains(String key) {
    return factories.containsKey(Objects.requireNonNull(key, "key"));
  }

  @Override
  public Set<String> keys() {
    return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
  }

  @Override
  public String toString() {
    return "DefaultFactoryRegistry[" + family.name() + ", keys=" + keys() + "]";
  }
}
