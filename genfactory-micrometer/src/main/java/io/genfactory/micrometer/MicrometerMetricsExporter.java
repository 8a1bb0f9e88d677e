package io.genfactory.micrometer;

import io.genfactory.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters with a {@link MeterRegistry} for export to Prometheus,
 * Grafana, Datadog, and other monitoring backends. Every counter carries a
 * {@code family} tag holding {@link io.genfactory.FactoryFamily#name()}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code genfactory.registrations}: factories inserted</li>
 *   <li>{@code genfactory.registrations.duplicate}: registrations dropped or rejected
 *       because the key was taken</li>
 *   <li>{@code genfactory.construct.success}: instances constructed</li>
 *   <li>{@code genfactory.construct.not_found}: construct calls for unknown keys</li>
 *   <li>{@code genfactory.construct.failure}: construct calls whose factory threw</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter {

  static final String FAMILY_TAG = "family";

  private final MeterRegistry registry;
  private final String registeredName;
  private final String duplicateName;
  private final String constructedName;
  private final String notFoundName;
  private final String failureName;

  /**
   * Creates an exporter with the default metric name prefix {@code "genfactory"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "genfactory");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "plugins.factory"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.registeredName = namePrefix + ".registrations";
    this.duplicateName = namePrefix + ".registrations.duplicate";
    this.constructedName = namePrefix + ".construct.success";
    this.notFoundName = namePrefix + ".construct.not_found";
    this.failureName = namePrefix + ".construct.failure";
  }

  @Override
  public void incrementRegistered(String family) {
    counter(registeredName, "Factories inserted into a registry", family).increment();
  }

  @Override
  public void incrementDuplicate(String family) {
    counter(duplicateName, "Registrations for keys already taken", family).increment();
  }

  @Override
  public void incrementConstructed(String family) {
    counter(constructedName, "Instances constructed", family).increment();
  }

  @Override
  public void incrementNotFound(String family) {
    counter(notFoundName, "Construct calls for unregistered keys", family).increment();
  }

  @Override
  public void incrementConstructionFailure(String family) {
    counter(failureName, "Construct calls whose factory threw", family).increment();
  }

  private Counter counter(String name, String description, String family) {
    return Counter.builder(name)
        .description(description)
        .tag(FAMILY_TAG, family)
        .register(registry);
  }
}
