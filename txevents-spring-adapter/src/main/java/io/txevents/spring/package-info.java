/**
 * Spring transaction integration.
 *
 * <p>{@link io.txevents.spring.SpringTransactionScope} and
 * {@link io.txevents.spring.SpringReadOnlyTransactionScope} let a
 * {@link org.springframework.transaction.PlatformTransactionManager} demarcate the unit of
 * work while repositories keep reading the transaction from the
 * {@link io.txevents.tx.TxContext}.
 */
package io.txevents.spring;
