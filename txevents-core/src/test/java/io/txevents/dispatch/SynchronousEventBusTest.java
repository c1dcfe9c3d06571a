package io.txevents.dispatch;

import io.txevents.SampleEvent;
import io.txevents.tx.ReadOnlyTransaction;
import io.txevents.tx.RowMapper;
import io.txevents.tx.TxContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SynchronousEventBusTest {

  @Test
  void deliversImmediately() {
    List<String> seen = new ArrayList<>();
    SynchronousEventBus bus = new SynchronousEventBus()
        .subscribe(SampleEvent.ITEM_CREATED, (ctx, e) -> seen.add(((SampleEvent) e).label()));

    bus.publish(TxContext.background(), SampleEvent.created("a"));

    assertEquals(List.of("a"), seen);
  }

  @Test
  void failingHandlerDoesNotStopOthers() {
    List<String> seen = new ArrayList<>();
    SynchronousEventBus bus = new SynchronousEventBus()
        .subscribe(SampleEvent.ITEM_CREATED, (ctx, e) -> {
          throw new IllegalStateException("mail server down");
        })
        .subscribe(SampleEvent.ITEM_CREATED, (ctx, e) -> seen.add("second"));

    assertDoesNotThrow(() -> bus.publish(TxContext.background(), SampleEvent.created("a")));
    assertEquals(List.of("second"), seen);
  }

  @Test
  void refusesToRunInsideTransaction() {
    SynchronousEventBus bus = new SynchronousEventBus();
    TxContext txCtx = TxContext.background().withReadOnlyTransaction(new ReadOnlyTransaction() {
      @Override
      public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
        return List.of();
      }
    });

    assertThrows(IllegalStateException.class, () -> bus.publish(txCtx, SampleEvent.created("a")));
  }

  @Test
  void subscriptionsAreIndependentOfOtherBuses() {
    SynchronousEventBus first = new SynchronousEventBus()
        .subscribe(SampleEvent.ITEM_CREATED, (ctx, e) -> { });
    SynchronousEventBus second = new SynchronousEventBus();

    assertEquals(1, first.handlerCount(SampleEvent.ITEM_CREATED));
    assertEquals(0, second.handlerCount(SampleEvent.ITEM_CREATED));
  }
}
