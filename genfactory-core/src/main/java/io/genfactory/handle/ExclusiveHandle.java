package io.genfactory.handle;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle with sole ownership of its instance.
 *
 * <p>An exclusive handle cannot be copied. Ownership moves with {@link #transfer()},
 * which leaves this handle empty, or leaves the handle system entirely with
 * {@link #release()}. Closing an owning handle closes an {@link AutoCloseable} instance.
 *
 * <pre>{@code
 * try (Handle<Connection> handle = registry.construct("pooled", config).orElseThrow()) {
 *   ExclusiveHandle<Connection> owned = (ExclusiveHandle<Connection>) handle;
 *   worker.adopt(owned.transfer());   // handle is now empty, close() is a no-op
 * }
 * }</pre>
 *
 * @param <T> the instance type
 */
public final class ExclusiveHandle<T> implements Handle<T> {
  private final AtomicReference<T> instance;

  ExclusiveHandle(T instance) {
    this.instance = new AtomicReference<>(Objects.requireNonNull(instance, "instance"));
  }

  @Override
  public T get() {
    T current = instance.get();
    if (current == null) {
      throw new IllegalStateException("Exclusive handle no longer owns its instance");
    }
    return current;
  }

  @Override
  public OwnershipPolicy ownership() {
    return OwnershipPolicy.EXCLUSIVE;
  }

  @Override
  public boolean isOpen() {
    return instance.get() != null;
  }

  /**
   * Moves ownership into a new handle. This handle becomes empty.
   *
   * @return the new owning handle
   * @throws IllegalStateException if this handle no longer owns an instance
   */
  public ExclusiveHandle<T> transfer() {
    return new ExclusiveHandle<>(take());
  }

  /**
   * Gives up ownership without closing the instance. This handle becomes empty and the
   * caller becomes responsible for the instance's lifetime.
   *
   * @return the instance
   * @throws IllegalStateException if this handle no longer owns an instance
   */
  public T release() {
    return take();
  }

  @Override
  public void close() {
    T owned = instance.getAndSet(null);
    if (owned != null) {
      Instances.closeIfCloseable(owned);
    }
  }

  private T take() {
    T owned = instance.getAndSet(null);
    if (owned == null) {
      throw new IllegalStateException("Exclusive handle no longer owns its instance");
    }
    return owned;
  }

  @Override
  public String toString() {
    T current = instance.get();
    return "ExclusiveHandle[" + (current != null ? current : "empty") + "]";
  }
}
