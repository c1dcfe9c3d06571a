package io.txevents.registry;

import io.txevents.BaseEvent;
import io.txevents.Event;
import io.txevents.EventHandler;
import io.txevents.SampleEvent;
import io.txevents.tx.TxContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultHandlerRegistryTest {

  @Test
  void returnsEmptyListForUnsubscribedType() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    assertTrue(registry.handlersFor(SampleEvent.ITEM_CREATED).isEmpty());
  }

  @Test
  void returnsHandlersInSubscriptionOrder() throws Exception {
    List<String> calls = new ArrayList<>();
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .subscribe(SampleEvent.ITEM_CREATED, (ctx, event) -> calls.add("first"))
        .subscribe(SampleEvent.ITEM_CREATED, (ctx, event) -> calls.add("second"))
        .subscribe(SampleEvent.ITEM_RENAMED, (ctx, event) -> calls.add("other"));

    for (EventHandler handler : registry.handlersFor(SampleEvent.ITEM_CREATED)) {
      handler.handle(TxContext.background(), SampleEvent.created("a"));
    }

    assertEquals(List.of("first", "second"), calls);
    assertEquals(2, registry.handlerCount(SampleEvent.ITEM_CREATED));
  }

  @Test
  void returnedListIsDetachedSnapshot() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .subscribe(SampleEvent.ITEM_CREATED, (ctx, event) -> { });

    List<EventHandler> snapshot = registry.handlersFor(SampleEvent.ITEM_CREATED);
    registry.subscribe(SampleEvent.ITEM_CREATED, (ctx, event) -> { });

    assertEquals(1, snapshot.size());
    assertThrows(UnsupportedOperationException.class, () -> snapshot.add((ctx, event) -> { }));
    assertEquals(2, registry.handlersFor(SampleEvent.ITEM_CREATED).size());
  }

  @Test
  void typedHandlerIgnoresOtherEventClasses() throws Exception {
    List<String> labels = new ArrayList<>();
    EventHandler typed = EventHandler.forType(SampleEvent.class, (ctx, event) -> labels.add(event.label()));
    Event foreign = new BaseEvent(SampleEvent.ITEM_CREATED, "x") { };

    typed.handle(TxContext.background(), foreign);
    typed.handle(TxContext.background(), SampleEvent.created("a"));

    assertEquals(List.of("a"), labels);
  }

  @Test
  void rejectsNulls() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    assertThrows(NullPointerException.class, () -> registry.subscribe(null, (ctx, event) -> { }));
    assertThrows(NullPointerException.class, () -> registry.subscribe(SampleEvent.ITEM_CREATED, null));
  }
}
