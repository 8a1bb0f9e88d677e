package io.genfactory;

import io.genfactory.bootstrap.FactoryProviders;
import io.genfactory.handle.Handle;
import io.genfactory.registry.FactoryCatalog;
import io.genfactory.registry.FactoryRegistry;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Static entry points backed by {@link FactoryCatalog#global()}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Factories.bootstrap();   // once, at startup
 *
 * Optional<Handle<Shape>> shape = Factories.construct(Shapes.FAMILY, "circle");
 * Optional<Handle<Model>> model = Factories.construct(Models.FAMILY, "arima", config);
 * }</pre>
 */
public final class Factories {
  private static final AtomicBoolean BOOTSTRAPPED = new AtomicBoolean();

  private Factories() {
  }

  /**
   * Installs every {@link io.genfactory.spi.FactoryProvider} on the classpath into the
   * global catalog. Only the first successful call does anything.
   *
   * @return true if this call ran the registration phase
   */
  public static boolean bootstrap() {
    if (!BOOTSTRAPPED.compareAndSet(false, true)) {
      return false;
    }
    try {
      FactoryProviders.installAll(FactoryCatalog.global());
    } catch (RuntimeException | Error e) {
      BOOTSTRAPPED.set(false);
      throw e;
    }
    return true;
  }

  public static FactoryCatalog catalog() {
    return FactoryCatalog.global();
  }

  public static <T, A> FactoryRegistry<T, A> registry(FactoryFamily<T, A> family) {
    return FactoryCatalog.global().registry(family);
  }

  public static <T, A> void register(FactoryFamily<T, A> family, String key,
      FactoryFunction<? extends T, ? super A> factory) {
    FactoryCatalog.global().register(family, key, factory);
  }

  public static <T, A> Optional<Handle<T>> construct(FactoryFamily<T, A> family, String key,
      A arguments) {
    return FactoryCatalog.global().construct(family, key, arguments);
  }

  public static <T> Optional<Handle<T>> construct(FactoryFamily<T, Void> family, String key) {
    return FactoryCatalog.global().construct(family, key, null);
  }
}
