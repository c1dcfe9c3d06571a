package io.txevents.spring.boot;

import io.txevents.EventHandler;
import io.txevents.EventSubscriber;
import io.txevents.EventType;
import io.txevents.dispatch.SynchronousEventBus;
import io.txevents.registry.DefaultHandlerRegistry;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link DomainEventHandler} and subscribes them.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see DomainEventHandler
 */
public class DomainEventHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultHandlerRegistry registry;
    private final SynchronousEventBus afterCommitBus;

    public DomainEventHandlerRegistrar(ListableBeanFactory beanFactory,
            DefaultHandlerRegistry registry, SynchronousEventBus afterCommitBus) {
        this.beanFactory = beanFactory;
        this.registry = registry;
        this.afterCommitBus = afterCommitBus;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(DomainEventHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof EventHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @DomainEventHandler must implement EventHandler, "
                                + "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation from getAnnotation
            DomainEventHandler annotation = AnnotationUtils.findAnnotation(
                    bean.getClass(), DomainEventHandler.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @DomainEventHandler annotation on " + bean.getClass().getName());
            }
            if (annotation.value().length == 0) {
                throw new BeanCreationException(beanName,
                        "@DomainEventHandler must name at least one event type");
            }

            EventSubscriber target = annotation.afterCommit() ? afterCommitBus : registry;
            for (String name : annotation.value()) {
                target.subscribe(resolveEventType(beanName, name), handler);
            }
        }
    }

    private static EventType resolveEventType(String beanName, String name) {
        try {
            return EventType.of(name);
        } catch (IllegalArgumentException e) {
            throw new BeanCreationException(beanName,
                    "@DomainEventHandler has an invalid event type: " + name, e);
        }
    }
}
