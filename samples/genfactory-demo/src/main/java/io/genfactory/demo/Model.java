package io.genfactory.demo;

import io.genfactory.FactoryFamily;
import io.genfactory.handle.OwnershipPolicy;
import io.genfactory.handle.PreferredOwnership;

/**
 * A trained model loaded from a path. Each caller gets its own copy.
 */
@PreferredOwnership(OwnershipPolicy.EXCLUSIVE)
public interface Model extends AutoCloseable {

  FactoryFamily<Model, String> FAMILY = FactoryFamily.of(Model.class, String.class);

  double predict(double input);

  @Override
  void close();
}
