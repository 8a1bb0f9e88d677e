package io.genfactory.handle;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reference-counted handle.
 *
 * <p>Every holder owns one reference: {@link #retain()} hands out another one, and
 * {@link #close()} gives this holder's reference back. The instance stays reachable
 * through any open holder and is closed, when it is {@link AutoCloseable}, once the
 * last reference is returned.
 *
 * @param <T> the instance type
 */
public final class SharedHandle<T> implements Handle<T> {
  private final Shared<T> shared;
  private final AtomicBoolean closed = new AtomicBoolean();

  SharedHandle(T instance) {
    this(new Shared<>(Objects.requireNonNull(instance, "instance")));
  }

  private SharedHandle(Shared<T> shared) {
    this.shared = shared;
  }

  @Override
  public T get() {
    if (closed.get()) {
      throw new IllegalStateException("Shared handle is closed");
    }
    return shared.instance;
  }

  @Override
  public OwnershipPolicy ownership() {
    return OwnershipPolicy.SHARED;
  }

  @Override
  public boolean isOpen() {
    return !closed.get();
  }

  /**
   * Creates another holder of the same instance.
   *
   * @return a new open handle sharing this handle's instance
   * @throws IllegalStateException if this handle is closed
   */
  public SharedHandle<T> retain() {
    int current;
    do {
      current = shared.references.get();
      // Zero means the instance was already closed by the last holder
      if (current == 0 || closed.get()) {
        throw new IllegalStateException("Cannot retain a closed shared handle");
      }
    } while (!shared.references.compareAndSet(current, current + 1));
    return new SharedHandle<>(shared);
  }

  /**
   * Returns the number of open holders of the instance.
   *
   * @return the current reference count
   */
  public int referenceCount() {
    return shared.references.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true) && shared.references.decrementAndGet() == 0) {
      Instances.closeIfCloseable(shared.instance);
    }
  }

  @Override
  public String toString() {
    return "SharedHandle[" + shared.instance + ", refs=" + shared.references.get() + "]";
  }

  private static final class Shared<T> {
    private final T instance;
    private final AtomicInteger references = new AtomicInteger(1);

    private Shared(T instance) {
      this.instance = instance;
    }
  }
}
