package io.txevents.spi;

/**
 * Observability hook for exporting dispatch and transaction counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. {@code txevents-micrometer} bridges
 * into Micrometer.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events buffered by a transactional dispatcher or handed to the
     * synchronous bus.
     */
    void incrementEventsPublished();

    /**
     * Increments the count of events whose handlers all completed.
     */
    void incrementEventsDispatched();

    /**
     * Increments the count of handler invocations that threw.
     */
    void incrementHandlerFailures();

    /**
     * Increments the count of flushes aborted by the depth limit.
     */
    void incrementDepthExceeded();

    /**
     * Increments the count of committed transactions.
     */
    default void incrementCommits() {
    }

    /**
     * Increments the count of rolled back transaction attempts.
     */
    default void incrementRollbacks() {
    }

    /**
     * Increments the count of attempts re-run after a transient conflict.
     */
    default void incrementRetries() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsPublished() {
        }

        @Override
        public void incrementEventsDispatched() {
        }

        @Override
        public void incrementHandlerFailures() {
        }

        @Override
        public void incrementDepthExceeded() {
        }
    }
}
