package io.genfactory.handle;

final class Instances {
  private Instances() {}

  static void closeIfCloseable(Object instance) {
    if (instance instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (RuntimeException e) {
        throw e;
      } catch (Exception e) {
        throw new HandleReleaseException(
            "Failed to close " + instance.getClass().getName(), e);
      }
    }
  }
}
