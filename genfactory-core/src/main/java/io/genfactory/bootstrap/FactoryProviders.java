package io.genfactory.bootstrap;

import io.genfactory.registry.FactoryCatalog;
import io.genfactory.spi.FactoryProvider;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Discovers {@link FactoryProvider} implementations and runs their registrations.
 *
 * <p>Providers are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.genfactory.spi.FactoryProvider} and run in
 * {@link FactoryProvider#order()} order, ties broken by class name, so the winner of
 * a key claimed by two providers does not depend on classpath order.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // At application startup, before the first construct call
 * FactoryProviders.installAll(FactoryCatalog.global());
 *
 * // List what is on the classpath
 * List<FactoryProvider> all = FactoryProviders.load(getClass().getClassLoader());
 * }</pre>
 */
public final class FactoryProviders {
  private static final Logger logger = Logger.getLogger(FactoryProviders.class.getName());

  private static final Comparator<FactoryProvider> ORDER =
      Comparator.comparingInt(FactoryProvider::order)
          .thenComparing(provider -> provider.getClass().getName());

  private FactoryProviders() {
  }

  /**
   * Loads all providers visible to the class loader, in registration order.
   *
   * @param classLoader the class loader to search
   * @return the providers, sorted
   */
  public static List<FactoryProvider> load(ClassLoader classLoader) {
    Objects.requireNonNull(classLoader, "classLoader");
    return ServiceLoader.load(FactoryProvider.class, classLoader)
        .stream()
        .map(ServiceLoader.Provider::get)
        .sorted(ORDER)
        .toList();
  }

  /**
   * Installs all providers visible to the context class loader into the catalog.
   *
   * @param catalog the catalog to populate
   * @return the number of providers that ran
   */
  public static int installAll(FactoryCatalog catalog) {
    return installAll(catalog, defaultClassLoader());
  }

  /**
   * Installs all providers visible to the class loader into the catalog. Providers
   * already installed in the catalog are skipped.
   *
   * @param catalog the catalog to populate
   * @param classLoader the class loader to search
   * @return the number of providers that ran
   */
  public static int installAll(FactoryCatalog catalog, ClassLoader classLoader) {
    Objects.requireNonNull(catalog, "catalog");
    return install(catalog, load(classLoader));
  }

  /**
   * Installs the given providers into the catalog in {@link FactoryProvider#order()} order.
   *
   * @param catalog the catalog to populate
   * @param providers the providers
   * @return the number of providers that ran
   */
  public static int install(FactoryCatalog catalog, List<? extends FactoryProvider> providers) {
    Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(providers, "providers");
    int installed = 0;
    for (FactoryProvider provider : providers.stream().sorted(ORDER).toList()) {
      if (catalog.install(provider)) {
        installed++;
      }
    }
    logger.log(Level.INFO, "Installed {0} of {1} factory providers",
        new Object[]{installed, providers.size()});
    return installed;
  }

  private static ClassLoader defaultClassLoader() {
    ClassLoader context = Thread.currentThread().getContextClassLoader();
    return context != null ? context : FactoryProviders.class.getClassLoader();
  }
}
