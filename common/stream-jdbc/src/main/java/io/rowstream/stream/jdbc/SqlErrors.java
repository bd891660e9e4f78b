package io.rowstream.stream.jdbc;

import java.sql.SQLException;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.function.Predicate;

final class SqlErrors {

  private SqlErrors() {
  }

  /**
   * Whether any {@link SQLException} in the cause chain of {@code error} satisfies {@code test}.
   */
  static boolean anySqlException(Throwable error, Predicate<SQLException> test) {
    Map<Throwable, Boolean> seen = new IdentityHashMap<>();
    Throwable current = error;
    while (current != null && seen.put(current, Boolean.TRUE) == null) {
      if (current instanceof SQLException sql && test.test(sql)) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
