package io.genfactory.demo;

import io.genfactory.FactoryFamily;

/**
 * Shapes sized by a single dimension.
 */
public interface Shape {

  FactoryFamily<Shape, Double> FAMILY = FactoryFamily.of(Shape.class, Double.class);

  String name();

  double area();
}
