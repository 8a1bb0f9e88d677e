package io.genfactory.spring.boot;

import io.genfactory.FactoryFamily;
import io.genfactory.FactoryFunction;
import io.genfactory.handle.ExclusiveHandle;
import io.genfactory.handle.OwnershipPolicy;
import io.genfactory.registry.DuplicatePolicy;
import io.genfactory.registry.DuplicateRegistrationException;
import io.genfactory.registry.FactoryCatalog;
import io.genfactory.spi.FactoryProvider;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class RegisteredFactoryRegistrarTest {

  private static final FactoryFamily<Shape, Void> SHAPES = FactoryFamily.of(Shape.class);
  private static final FactoryFamily<Shape, Integer> POLYGONS = FactoryFamily.of(Shape.class, Integer.class);

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(CatalogConfig.class);

  @Test
  void registersArgumentlessFactory() {
    runner.withUserConfiguration(CircleConfig.class).run(ctx -> {
      var catalog = ctx.getBean(FactoryCatalog.class);
      assertEquals("circle", catalog.construct(SHAPES, "circle", null).orElseThrow().get().name());
    });
  }

  @Test
  void registersFactoryWithArguments() {
    runner.withUserConfiguration(PolygonConfig.class).run(ctx -> {
      var catalog = ctx.getBean(FactoryCatalog.class);
      assertEquals("6-gon", catalog.construct(POLYGONS, "polygon", 6).orElseThrow().get().name());
      assertTrue(catalog.construct(SHAPES, "polygon", null).isEmpty());
    });
  }

  @Test
  void ownershipOverrideSelectsFamily() {
    runner.withUserConfiguration(ExclusiveCircleConfig.class).run(ctx -> {
      var catalog = ctx.getBean(FactoryCatalog.class);
      var exclusive = SHAPES.withOwnership(OwnershipPolicy.EXCLUSIVE);

      var handle = catalog.construct(exclusive, "circle", null).orElseThrow();

      assertInstanceOf(ExclusiveHandle.class, handle);
      assertTrue(catalog.construct(SHAPES, "circle", null).isEmpty());
    });
  }

  @Test
  void installsProviderBeans() {
    runner.withUserConfiguration(ProviderConfig.class).run(ctx -> {
      var catalog = ctx.getBean(FactoryCatalog.class);
      assertEquals("hexagon", catalog.construct(SHAPES, "hexagon", null).orElseThrow().get().name());
    });
  }

  @Test
  void failsWhenBeanDoesNotImplementFactoryFunction() {
    runner.withUserConfiguration(NotAFactoryConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenKeyIsBlank() {
    runner.withUserConfiguration(BlankKeyConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenOwnershipIsAmbiguous() {
    runner.withUserConfiguration(AmbiguousOwnershipConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void duplicateKeyFailsStartupUnderStrictPolicy() {
    new ApplicationContextRunner()
        .withUserConfiguration(StrictCatalogConfig.class, CircleConfig.class, SecondCircleConfig.class)
        .run(ctx -> {
          var failure = ctx.getStartupFailure();
          assertInstanceOf(BeanCreationException.class, failure);
          assertInstanceOf(DuplicateRegistrationException.class, failure.getCause());
        });
  }

  @Test
  void duplicateKeyIsIgnoredByDefault() {
    runner.withUserConfiguration(CircleConfig.class, SecondCircleConfig.class).run(ctx -> {
      assertNull(ctx.getStartupFailure());
      var catalog = ctx.getBean(FactoryCatalog.class);
      assertEquals(1, catalog.registry(SHAPES).keys().size());
    });
  }

  // ── Test support ─────────────────────────────────────────────

  public interface Shape {
    String name();
  }

  @RegisteredFactory(family = Shape.class, key = "circle")
  static class CircleFactory implements FactoryFunction<Shape, Void> {
    @Override
    public Shape create(Void ignored) {
      return () -> "circle";
    }
  }

  @RegisteredFactory(family = Shape.class, key = "circle")
  static class OtherCircleFactory implements FactoryFunction<Shape, Void> {
    @Override
    public Shape create(Void ignored) {
      return () -> "other circle";
    }
  }

  @RegisteredFactory(family = Shape.class, arguments = Integer.class, key = "polygon")
  static class PolygonFactory implements FactoryFunction<Shape, Integer> {
    @Override
    public Shape create(Integer sides) {
      return () -> sides + "-gon";
    }
  }

  @RegisteredFactory(family = Shape.class, key = "circle", ownership = OwnershipPolicy.EXCLUSIVE)
  static class ExclusiveCircleFactory implements FactoryFunction<Shape, Void> {
    @Override
    public Shape create(Void ignored) {
      return () -> "circle";
    }
  }

  @RegisteredFactory(family = Shape.class, key = "circle",
      ownership = {OwnershipPolicy.EXCLUSIVE, OwnershipPolicy.BORROWED})
  static class AmbiguousFactory implements FactoryFunction<Shape, Void> {
    @Override
    public Shape create(Void ignored) {
      return () -> "circle";
    }
  }

  @RegisteredFactory(family = Shape.class, key = " ")
  static class BlankKeyFactory implements FactoryFunction<Shape, Void> {
    @Override
    public Shape create(Void ignored) {
      return () -> "blank";
    }
  }

  @RegisteredFactory(family = Shape.class, key = "nothing")
  static class NotAFactory {
  }

  static class HexagonProvider implements FactoryProvider {
    @Override
    public void registerFactories(FactoryCatalog catalog) {
      catalog.register(SHAPES, "hexagon", ignored -> () -> "hexagon");
    }
  }

  @Configuration
  static class CatalogConfig {
    @Bean
    FactoryCatalog factoryCatalog() {
      return FactoryCatalog.builder().build();
    }

    @Bean
    RegisteredFactoryRegistrar registeredFactoryRegistrar(ListableBeanFactory beanFactory, FactoryCatalog catalog) {
      return new RegisteredFactoryRegistrar(beanFactory, catalog);
    }
  }

  @Configuration
  static class StrictCatalogConfig {
    @Bean
    FactoryCatalog factoryCatalog() {
      return FactoryCatalog.builder().duplicatePolicy(DuplicatePolicy.FAIL).build();
    }

    @Bean
    RegisteredFactoryRegistrar registeredFactoryRegistrar(ListableBeanFactory beanFactory, FactoryCatalog catalog) {
      return new RegisteredFactoryRegistrar(beanFactory, catalog);
    }
  }

  @Configuration
  static class CircleConfig {
    @Bean
    CircleFactory circleFactory() {
      return new CircleFactory();
    }
  }

  @Configuration
  static class SecondCircleConfig {
    @Bean
    OtherCircleFactory otherCircleFactory() {
      return new OtherCircleFactory();
    }
  }

  @Configuration
  static class PolygonConfig {
    @Bean
    PolygonFactory polygonFactory() {
      return new PolygonFactory();
    }
  }

  @Configuration
  static class ExclusiveCircleConfig {
    @Bean
    ExclusiveCircleFactory exclusiveCircleFactory() {
      return new ExclusiveCircleFactory();
    }
  }

  @Configuration
  static class AmbiguousOwnershipConfig {
    @Bean
    AmbiguousFactory ambiguousFactory() {
      return new AmbiguousFactory();
    }
  }

  @Configuration
  static class BlankKeyConfig {
    @Bean
    BlankKeyFactory blankKeyFactory() {
      return new BlankKeyFactory();
    }
  }

  @Configuration
  static class NotAFactoryConfig {
    @Bean
    NotAFactory notAFactory() {
      return new NotAFactory();
    }
  }

  @Configuration
  static class ProviderConfig {
    @Bean
    HexagonProvider hexagonProvider() {
      return new HexagonProvider();
    }
  }
}
