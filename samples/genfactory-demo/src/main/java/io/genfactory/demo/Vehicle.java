package io.genfactory.demo;

import io.genfactory.FactoryFamily;

public interface Vehicle {

  FactoryFamily<Vehicle, Void> FAMILY = FactoryFamily.of(Vehicle.class);

  int wheels();
}
