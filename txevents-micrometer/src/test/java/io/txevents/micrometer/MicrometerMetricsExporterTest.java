package io.txevents.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.txevents.BaseEvent;
import io.txevents.EventType;
import io.txevents.dispatch.EventHandlerException;
import io.txevents.dispatch.EventProcessingDepthExceededException;
import io.txevents.dispatch.TransactionalEventDispatcher;
import io.txevents.registry.DefaultHandlerRegistry;
import io.txevents.tx.TxContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {
  private static final EventType NOTED = EventType.of("notes.NoteAdded");

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void transactionCountersUseDefaultPrefix() {
    exporter.incrementCommits();
    exporter.incrementCommits();
    exporter.incrementRollbacks();
    exporter.incrementRetries();

    assertEquals(2.0, counter("txevents.tx.commits").count());
    assertEquals(1.0, counter("txevents.tx.rollbacks").count());
    assertEquals(1.0, counter("txevents.tx.retries").count());
  }

  @Test
  void dispatcherReportsThroughExporter() {
    DefaultHandlerRegistry handlers = new DefaultHandlerRegistry()
        .subscribe(NOTED, (ctx, event) -> {
          if (event.aggregateId().equals("bad")) {
            throw new IllegalStateException("rejected");
          }
        });
    TransactionalEventDispatcher dispatcher = TransactionalEventDispatcher.builder()
        .handlerRegistry(handlers)
        .maxDepth(2)
        .metrics(exporter)
        .build();

    dispatcher.publish(TxContext.background(), note("ok"));
    dispatcher.flush(TxContext.background());
    dispatcher.publish(TxContext.background(), note("bad"));
    assertThrows(EventHandlerException.class, () -> dispatcher.flush(TxContext.background()));
    for (int i = 0; i < 3; i++) {
      dispatcher.publish(TxContext.background(), note("ok"));
    }
    assertThrows(EventProcessingDepthExceededException.class, () -> dispatcher.flush(TxContext.background()));

    assertEquals(5.0, counter("txevents.events.published").count());
    assertEquals(3.0, counter("txevents.events.dispatched").count());
    assertEquals(1.0, counter("txevents.handler.failures").count());
    assertEquals(1.0, counter("txevents.dispatch.depth.exceeded").count());
  }

  @Test
  void customPrefix() {
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "orders.txevents");

    custom.incrementEventsPublished();

    assertEquals(1.0, counter("orders.txevents.events.published").count());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "txevents."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterIncrements() {
    exporter.close();
    exporter.incrementCommits();

    assertNull(registry.find("txevents.tx.commits").counter());
  }

  private static BaseEvent note(String aggregateId) {
    return new BaseEvent(NOTED, aggregateId) { };
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }
}
