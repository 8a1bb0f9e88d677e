package io.genfactory.demo;

import io.genfactory.Factories;
import io.genfactory.handle.ExclusiveHandle;
import io.genfactory.handle.Handle;
import io.genfactory.handle.SharedHandle;

import java.util.Optional;

/**
 * Simple demo showing factory registration and construction without Spring.
 *
 * Run with: mvn -pl samples/genfactory-demo exec:java
 */
public final class FactoryDemo {

  public static void main(String[] args) {
    // 1. Install providers listed in META-INF/services
    Factories.bootstrap();

    // 2. Register two families that share a key
    Factories.register(Animal.FAMILY, "base", ignored -> () -> "...");
    Factories.register(Animal.FAMILY, "dog", ignored -> () -> "woof");
    Factories.register(Vehicle.FAMILY, "base", ignored -> () -> 4);
    Factories.register(Animal.FAMILY, "dog", ignored -> () -> "meow");

    // 3. Static registrars run when their class is initialized
    System.out.println("[Registrar] " + LinearModel.REGISTRAR);

    // 4. Construct shapes by key
    for (String key : new String[]{"circle", "square", "triangle"}) {
      Optional<Handle<Shape>> shape = Factories.construct(Shape.FAMILY, key, 2.0);
      if (shape.isPresent()) {
        try (Handle<Shape> handle = shape.get()) {
          System.out.printf("[Shape] %s area=%.2f%n", handle.get().name(), handle.get().area());
        }
      } else {
        System.out.println("[Shape] No factory registered for '" + key + "'");
      }
    }

    // 5. Same key, different families
    try (Handle<Animal> animal = Factories.construct(Animal.FAMILY, "base").orElseThrow();
         Handle<Vehicle> vehicle = Factories.construct(Vehicle.FAMILY, "base").orElseThrow()) {
      System.out.println("[Family] Animal/base says " + animal.get().sound());
      System.out.println("[Family] Vehicle/base has " + vehicle.get().wheels() + " wheels");
    }

    // 6. First registration wins
    try (Handle<Animal> dog = Factories.construct(Animal.FAMILY, "dog").orElseThrow()) {
      System.out.println("[Registry] dog says " + dog.get().sound());
    }

    // 7. Shared handles count references
    SharedHandle<Animal> first = (SharedHandle<Animal>) Factories.construct(Animal.FAMILY, "dog").orElseThrow();
    SharedHandle<Animal> second = first.retain();
    System.out.println("[Shared] references=" + first.referenceCount());
    first.close();
    second.close();

    // 8. Exclusive handles move rather than copy
    ExclusiveHandle<Model> model =
        (ExclusiveHandle<Model>) Factories.construct(Model.FAMILY, "linear", "/models/linear.bin").orElseThrow();
    try (ExclusiveHandle<Model> owner = model.transfer()) {
      System.out.println("[Exclusive] predict(3)=" + owner.get().predict(3));
      System.out.println("[Exclusive] source handle open=" + model.isOpen());
    }

    System.out.println("Done.");
  }
}
