package io.txevents.dispatch;

import io.txevents.Event;
import io.txevents.tx.TxContext;

/**
 * Cross-cutting hook around the handlers of one event.
 *
 * <p>Interceptors run around handler invocation:
 * <ol>
 *   <li>{@link #beforeHandle} in registration order</li>
 *   <li>Every handler of the event, in subscription order</li>
 *   <li>{@link #afterHandle} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeHandle} throws, the handlers are skipped and the flush fails as if a
 * handler had thrown. {@code afterHandle} exceptions are logged but swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * TransactionalEventDispatchers.builder()
 *     .handlerRegistry(registry)
 *     .interceptor(DispatchInterceptor.before((ctx, event) ->
 *         audit.record(ctx, event.eventType(), event.eventId())))
 *     .build();
 * }</pre>
 */
public interface DispatchInterceptor {

    /**
     * Called before the handlers of an event are invoked. Runs inside the transaction, so
     * writes made here commit or roll back with the unit of work.
     *
     * @param ctx   the context of the unit of work
     * @param event the event about to be handled
     * @throws Exception to abort the flush
     */
    default void beforeHandle(TxContext ctx, Event event) throws Exception {
    }

    /**
     * Called after the handlers ran (or after a {@code beforeHandle} failure).
     *
     * @param event the event
     * @param error null on success, the exception on failure
     */
    default void afterHandle(Event event, Exception error) {
    }

    /**
     * Creates an interceptor with only a beforeHandle hook.
     */
    static DispatchInterceptor before(BeforeHook hook) {
        return new DispatchInterceptor() {
            @Override
            public void beforeHandle(TxContext ctx, Event event) throws Exception {
                hook.accept(ctx, event);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterHandle hook.
     */
    static DispatchInterceptor after(AfterHook hook) {
        return new DispatchInterceptor() {
            @Override
            public void afterHandle(Event event, Exception error) {
                hook.accept(event, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(TxContext ctx, Event event) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(Event event, Exception error);
    }
}
