package io.genfactory.demo;

import io.genfactory.registry.FactoryCatalog;
import io.genfactory.spi.FactoryProvider;

/**
 * Registers the built-in shapes. Discovered through {@code META-INF/services}.
 */
public final class ShapeFactories implements FactoryProvider {

  @Override
  public void registerFactories(FactoryCatalog catalog) {
    catalog.register(Shape.FAMILY, "circle", Circle::new);
    catalog.register(Shape.FAMILY, "square", Square::new);
  }

  record Circle(Double radius) implements Shape {
    @Override
    public String name() {
      return "circle";
    }

    @Override
    public double area() {
      return Math.PI * radius * radius;
    }
  }

  record Square(Double side) implements Shape {
    @Override
    public String name() {
      return "square";
    }

    @Override
    public double area() {
      return side * side;
    }
  }
}
