package io.txevents.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Subscribes a Spring bean to one or more domain event types.
 *
 * <p>The annotated bean must implement {@link io.txevents.EventHandler}. Each value is an
 * event type name of the form {@code module.Verb}.
 *
 * <pre>{@code
 * @Component
 * @DomainEventHandler("users.UserDeleted")
 * public class UserDeletedHandler implements EventHandler {
 *   public void handle(TxContext ctx, Event event) { ... }
 * }
 * }</pre>
 *
 * <p>By default the bean joins the transactional registry and runs inside the publishing
 * transaction. With {@code afterCommit = true} it is subscribed on the
 * {@link io.txevents.dispatch.SynchronousEventBus} instead.
 *
 * @see DomainEventHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface DomainEventHandler {

    /**
     * Event type names this handler receives. At least one is required.
     */
    String[] value();

    /**
     * Subscribe on the after-commit bus rather than the transactional registry.
     */
    boolean afterCommit() default false;
}
