package io.txevents.jdbc.tx;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;

/**
 * Hands out a view of a connection whose {@code close()} does nothing, so a test can inspect
 * the connection after a scope has released it.
 */
final class UnclosableConnection {
  private final Connection target;

  UnclosableConnection(Connection target) {
    this.target = target;
  }

  Connection proxy() {
    return (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[] {Connection.class},
        (proxy, method, args) -> {
          if (method.getName().equals("close")) {
            return null;
          }
          try {
            return method.invoke(target, args);
          } catch (InvocationTargetException e) {
            throw e.getCause();
          }
        });
  }
}
