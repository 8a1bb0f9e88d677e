package io.genfactory.handle;

/**
 * Unchecked exception thrown when a handle fails to close the {@link AutoCloseable}
 * instance it owns.
 */
public final class HandleReleaseException extends RuntimeException {
  public HandleReleaseException(String message, Throwable cause) {
    super(message, cause);
  }
}
