package io.txevents.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.txevents.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code txevents.events.published}: events buffered or handed to the synchronous bus</li>
 *   <li>{@code txevents.events.dispatched}: events whose handlers all ran</li>
 *   <li>{@code txevents.handler.failures}: handler invocations that threw</li>
 *   <li>{@code txevents.dispatch.depth.exceeded}: flushes stopped by the depth limit</li>
 *   <li>{@code txevents.tx.commits}: committed transactions</li>
 *   <li>{@code txevents.tx.rollbacks}: rolled back transaction attempts</li>
 *   <li>{@code txevents.tx.retries}: attempts rerun after a transient conflict</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter eventsPublished;
  private final Counter eventsDispatched;
  private final Counter handlerFailures;
  private final Counter depthExceeded;
  private final Counter commits;
  private final Counter rollbacks;
  private final Counter retries;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "txevents"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "txevents");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.txevents"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty() || namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must be non-empty and must not end with '.': " + namePrefix);
    }

    this.registry = registry;
    this.eventsPublished = counter(namePrefix + ".events.published", "Events published");
    this.eventsDispatched = counter(namePrefix + ".events.dispatched", "Events whose handlers completed");
    this.handlerFailures = counter(namePrefix + ".handler.failures", "Handler invocations that failed");
    this.depthExceeded = counter(namePrefix + ".dispatch.depth.exceeded", "Flushes aborted by the depth limit");
    this.commits = counter(namePrefix + ".tx.commits", "Committed transactions");
    this.rollbacks = counter(namePrefix + ".tx.rollbacks", "Rolled back transaction attempts");
    this.retries = counter(namePrefix + ".tx.retries", "Transaction attempts retried after a transient conflict");
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementEventsPublished() {
    if (closed) return;
    eventsPublished.increment();
  }

  @Override
  public void incrementEventsDispatched() {
    if (closed) return;
    eventsDispatched.increment();
  }

  @Override
  public void incrementHandlerFailures() {
    if (closed) return;
    handlerFailures.increment();
  }

  @Override
  public void incrementDepthExceeded() {
    if (closed) return;
    depthExceeded.increment();
  }

  @Override
  public void incrementCommits() {
    if (closed) return;
    commits.increment();
  }

  @Override
  public void incrementRollbacks() {
    if (closed) return;
    rollbacks.increment();
  }

  @Override
  public void incrementRetries() {
    if (closed) return;
    retries.increment();
  }

  /**
   * Removes this exporter's meters from the registry. Later increments are ignored.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(eventsPublished, eventsDispatched, handlerFailures,
        depthExceeded, commits, rollbacks, retries)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
