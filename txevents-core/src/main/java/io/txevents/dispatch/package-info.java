/**
 * Event delivery.
 *
 * <p>{@link io.txevents.dispatch.TransactionalEventDispatcher} buffers the events of one unit
 * of work and delivers them inside its transaction on flush, with a depth limit that stops
 * handler cycles. {@link io.txevents.dispatch.SynchronousEventBus} delivers immediately and
 * best-effort, outside any transaction.
 *
 * @see io.txevents.dispatch.TransactionalEventDispatchers
 * @see io.txevents.dispatch.DispatchInterceptor
 */
package io.txevents.dispatch;
