package io.genfactory.handle;

import java.util.Objects;

/**
 * Non-owning handle. {@link #close()} does nothing; the caller manages the
 * instance's lifetime entirely.
 *
 * @param <T> the instance type
 */
public final class BorrowedHandle<T> implements Handle<T> {
  private final T instance;

  BorrowedHandle(T instance) {
    this.instance = Objects.requireNonNull(instance, "instance");
  }

  @Override
  public T get() {
    return instance;
  }

  @Override
  public OwnershipPolicy ownership() {
    return OwnershipPolicy.BORROWED;
  }

  @Override
  public boolean isOpen() {
    return true;
  }

  @Override
  public void close() {
  }

  @Override
  public String toString() {
    return "BorrowedHandle[" + instance + "]";
  }
}
