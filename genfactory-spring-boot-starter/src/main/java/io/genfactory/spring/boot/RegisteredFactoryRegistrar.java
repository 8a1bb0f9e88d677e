package io.genfactory.spring.boot;

import io.genfactory.FactoryFamily;
import io.genfactory.FactoryFunction;
import io.genfactory.bootstrap.FactoryProviders;
import io.genfactory.handle.OwnershipPolicy;
import io.genfactory.registry.DuplicateRegistrationException;
import io.genfactory.registry.FactoryCatalog;
import io.genfactory.spi.FactoryProvider;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.List;
import java.util.Map;

/**
 * Installs {@link FactoryProvider} beans and scans for beans annotated with
 * {@link RegisteredFactory}, inserting them into the {@link FactoryCatalog}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 * Provider beans run first, then annotated beans in bean definition order.
 *
 * @see RegisteredFactory
 */
public class RegisteredFactoryRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final FactoryCatalog catalog;

    public RegisteredFactoryRegistrar(ListableBeanFactory beanFactory, FactoryCatalog catalog) {
        this.beanFactory = beanFactory;
        this.catalog = catalog;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, FactoryProvider> providers = beanFactory.getBeansOfType(FactoryProvider.class);
        FactoryProviders.install(catalog, List.copyOf(providers.values()));

        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(RegisteredFactory.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof FactoryFunction<?, ?> factory)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @RegisteredFactory must implement FactoryFunction, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            RegisteredFactory annotation = bean.getClass().getAnnotation(RegisteredFactory.class);
            if (annotation == null) {
                // Proxy may hide annotation; try the target class
                annotation = AnnotationUtils.findAnnotation(bean.getClass(), RegisteredFactory.class);
            }
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @RegisteredFactory annotation on " + bean.getClass().getName());
            }
            if (annotation.key().isBlank()) {
                throw new BeanCreationException(beanName, "@RegisteredFactory key must not be blank");
            }

            FactoryFamily<?, ?> family = resolveFamily(beanName, annotation);
            try {
                register(family, annotation.key(), factory);
            } catch (DuplicateRegistrationException e) {
                throw new BeanCreationException(beanName, e.getMessage(), e);
            }
        }
    }

    private FactoryFamily<?, ?> resolveFamily(String beanName, RegisteredFactory annotation) {
        FactoryFamily<?, ?> family = FactoryFamily.of(annotation.family(), annotation.arguments());
        OwnershipPolicy[] ownership = annotation.ownership();
        if (ownership.length > 1) {
            throw new BeanCreationException(beanName,
                    "@RegisteredFactory ownership accepts at most one policy");
        }
        return ownership.length == 1 ? family.withOwnership(ownership[0]) : family;
    }

    @SuppressWarnings("unchecked")
    private <T, A> void register(FactoryFamily<T, A> family, String key, FactoryFunction<?, ?> factory) {
        catalog.register(family, key, (FactoryFunction<T, A>) factory);
    }
}
