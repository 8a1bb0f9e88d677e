package io.genfactory.handle;

/**
 * Ownership-qualified reference to an instance produced by a factory.
 *
 * <p>Closing a handle ends this holder's claim on the instance. Whether that also
 * closes the instance depends on the handle kind:
 * <ul>
 *   <li>{@link ExclusiveHandle} closes an {@link AutoCloseable} instance immediately</li>
 *   <li>{@link SharedHandle} closes it when the last holder closes</li>
 *   <li>{@link BorrowedHandle} never closes it</li>
 * </ul>
 *
 * <p>Closing is idempotent.
 *
 * @param <T> the instance type
 * @see OwnershipPolicy
 */
public sealed interface Handle<T> extends AutoCloseable
    permits ExclusiveHandle, SharedHandle, BorrowedHandle {

  /**
   * Returns the referenced instance.
   *
   * @return the instance, never null
   * @throws IllegalStateException if this holder no longer has access to the instance
   */
  T get();

  /**
   * Returns the ownership policy this handle implements.
   *
   * @return the policy
   */
  OwnershipPolicy ownership();

  /**
   * Returns whether {@link #get()} can currently be called.
   *
   * @return true if the handle is still usable
   */
  boolean isOpen();

  /**
   * Releases this holder's claim on the instance.
   *
   * @throws HandleReleaseException if closing the underlying instance fails
   */
  @Override
  void close();
}
