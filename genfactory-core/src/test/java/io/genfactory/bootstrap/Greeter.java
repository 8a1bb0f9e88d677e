package io.genfactory.bootstrap;

import io.genfactory.FactoryFamily;

public interface Greeter {
  FactoryFamily<Greeter, String> FAMILY = FactoryFamily.of(Greeter.class, String.class);

  String greet();
}
