package io.txevents;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventTypeTest {

  @Test
  void acceptsModuleDotPastTenseVerb() {
    EventType type = EventType.of("users.UserDeleted");

    assertEquals("users.UserDeleted", type.name());
    assertEquals("users", type.module());
    assertEquals("UserDeleted", type.verb());
    assertEquals("users.UserDeleted", type.toString());
  }

  @Test
  void rejectsMalformedNames() {
    for (String bad : new String[] {
        "", "users", "UserDeleted", "Users.UserDeleted", "users.userDeleted",
        "users.User-Deleted", "users.", ".UserDeleted", "user_s.UserDeleted",
        "users.UserDeleted.x", "users.U"}) {
      assertFalse(EventType.isValid(bad), bad);
      assertThrows(IllegalArgumentException.class, () -> EventType.of(bad), bad);
    }
  }

  @Test
  void errorMessageNamesTheOffendingValue() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> EventType.of("orders.order_submitted"));

    assertTrue(ex.getMessage().contains("orders.order_submitted"));
  }

  @Test
  void nullIsRejected() {
    assertThrows(NullPointerException.class, () -> EventType.of(null));
    assertFalse(EventType.isValid(null));
  }

  @Test
  void equalityIsByName() {
    assertEquals(EventType.of("orders.OrderSubmitted"), EventType.of("orders.OrderSubmitted"));
    assertEquals(EventType.of("orders.OrderSubmitted").hashCode(),
        EventType.of("orders.OrderSubmitted").hashCode());
    assertNotEquals(EventType.of("orders.OrderSubmitted"), EventType.of("orders.OrderCancelled"));
  }
}
