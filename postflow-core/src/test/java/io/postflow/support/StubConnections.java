package io.postflow.support;

import io.postflow.spi.ConnectionProvider;

import java.lang.reflect.Proxy;
import java.sql.Connection;

/**
 * Connection provider handing out inert proxies, for stores that ignore the connection.
 */
public final class StubConnections {
  private StubConnections() {
  }

  public static ConnectionProvider provider() {
    return () -> (Connection) Proxy.newProxyInstance(
        StubConnections.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> {
          Class<?> type = method.getReturnType();
          if (type == boolean.class) return false;
          if (type == int.class) return 0;
          return null;
        });
  }
}
