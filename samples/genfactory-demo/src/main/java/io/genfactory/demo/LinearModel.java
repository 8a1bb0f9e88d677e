package io.genfactory.demo;

import io.genfactory.Registrar;

/**
 * Registers itself when the class is initialized.
 */
public final class LinearModel implements Model {

  public static final Registrar<Model, String> REGISTRAR =
      new Registrar<>(Model.FAMILY, "linear", LinearModel::new);

  private final String path;

  LinearModel(String path) {
    this.path = path;
  }

  @Override
  public double predict(double input) {
    return 2 * input + 1;
  }

  @Override
  public void close() {
    System.out.println("[Model] Unloaded " + path);
  }
}
