package io.genfactory.demo;

import io.genfactory.FactoryFamily;

public interface Animal {

  FactoryFamily<Animal, Void> FAMILY = FactoryFamily.of(Animal.class);

  String sound();
}
