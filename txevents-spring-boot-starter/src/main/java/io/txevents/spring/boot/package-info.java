/**
 * Spring Boot auto-configuration for txevents.
 *
 * <p>Adding the starter with a {@link javax.sql.DataSource} in the context provides a
 * {@link io.txevents.dispatch.TransactionalEventDispatchers} factory, read-write and
 * read-only transaction scopes, and subscribes beans annotated with
 * {@link io.txevents.spring.boot.DomainEventHandler}. Settings live under the
 * {@code txevents} prefix, see {@link io.txevents.spring.boot.TxEventsProperties}.
 */
package io.txevents.spring.boot;
